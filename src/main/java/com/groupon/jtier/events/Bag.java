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

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Holds event handlers which are invoked every time the event fires. A handler stays in the bag until
 * the {@link HandlerId} returned by {@link #add(Object)} is closed or discarded.
 * <p>
 * Typical usage is one bag per event, held by the object which owns the event:
 * <pre>{@code
 * private final Bag<Consumer<String>> onMessage = new Bag<>();
 *
 * public HandlerId onMessage(Consumer<String> handler) {
 *     return onMessage.add(handler);
 * }
 *
 * private void received(String message) {
 *     Bag.callSimple(onMessage, message);
 * }
 * }</pre>
 * <p>
 * Handlers are invoked on the thread firing the event, without any lock held. A handler added or
 * removed while the event is firing may or may not be invoked by that round. The order in which
 * handlers are invoked is unspecified.
 *
 * @param <F> handler type
 */
public class Bag<F> {

    private final HandlerMap<F> handlers = new HandlerMap<>();

    /**
     * Add a handler to the bag. The same handler instance may be added to any number of bags; each
     * registration is removed independently.
     *
     * @return a {@link HandlerId} which removes the handler when closed or discarded.
     */
    public HandlerId add(final F handler) {
        return this.handlers.register(handler);
    }

    /**
     * Pass each registered handler to the applicator. Handlers stay in the bag.
     */
    public void call(final Consumer<? super F> applicator) {
        Objects.requireNonNull(applicator, "applicator");
        for (final F handler : this.handlers.snapshot()) {
            applicator.accept(handler);
        }
    }

    public int size() {
        return this.handlers.size();
    }

    @Override
    public String toString() {
        return "Bag{handlers=" + size() + "}";
    }

    public static void callSimple(final Bag<? extends Runnable> bag) {
        bag.call(Runnable::run);
    }

    public static <A1> void callSimple(final Bag<? extends Consumer<? super A1>> bag, final A1 a1) {
        bag.call(h -> h.accept(a1));
    }

    public static <A1, A2> void callSimple(final Bag<? extends BiConsumer<? super A1, ? super A2>> bag,
                                           final A1 a1, final A2 a2) {
        bag.call(h -> h.accept(a1, a2));
    }

    public static <A1, A2, A3> void callSimple(final Bag<? extends Handler3<? super A1, ? super A2, ? super A3>> bag,
                                               final A1 a1, final A2 a2, final A3 a3) {
        bag.call(h -> h.accept(a1, a2, a3));
    }

    public static <A1, A2, A3, A4> void callSimple(
            final Bag<? extends Handler4<? super A1, ? super A2, ? super A3, ? super A4>> bag,
            final A1 a1, final A2 a2, final A3 a3, final A4 a4) {
        bag.call(h -> h.accept(a1, a2, a3, a4));
    }

    public static <A1, A2, A3, A4, A5> void callSimple(
            final Bag<? extends Handler5<? super A1, ? super A2, ? super A3, ? super A4, ? super A5>> bag,
            final A1 a1, final A2 a2, final A3 a3, final A4 a4, final A5 a5) {
        bag.call(h -> h.accept(a1, a2, a3, a4, a5));
    }
}
