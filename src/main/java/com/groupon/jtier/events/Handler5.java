/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.groupon.jtier.events;

/**
 * Five argument handler, see {@link Handler3}.
 */
@FunctionalInterface
public interface Handler5<A1, A2, A3, A4, A5> {
    void accept(A1 a1, A2 a2, A3 a3, A4 a4, A5 a5);
}
