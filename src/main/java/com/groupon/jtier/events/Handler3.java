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
 * A handler taking three arguments. Register it with {@link Bag} or {@link BagOnce} and fire it with
 * the matching {@code callSimple} overload.
 */
@FunctionalInterface
public interface Handler3<A1, A2, A3> {
    void accept(A1 a1, A2 a2, A3 a3);
}
