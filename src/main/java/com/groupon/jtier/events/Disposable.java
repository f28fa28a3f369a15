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
 * Something registered that can be taken back out again, such as the {@link HandlerId}
 * returned when a handler is added to a {@link Bag} or {@link BagOnce}.
 */
@FunctionalInterface
public interface Disposable {
    /**
     * Removes the registration. Invoking it more than once has no further effect.
     */
    void dispose();
}
