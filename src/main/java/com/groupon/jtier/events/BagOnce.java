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
 * Holds event handlers which are invoked at most once. Firing the event takes every handler out of the
 * bag before invoking it, so a second firing invokes only handlers added in between.
 * <p>
 * A handler can be cancelled before it fires by closing the {@link HandlerId} returned from
 * {@link #add(Object)}. Closing it after the handler fired does nothing.
 * <p>
 * Handlers added while the event is firing are kept for the next firing.
 *
 * @param <F> handler type
 */
public class BagOnce<F> {

    private final HandlerMap<F> handlers = new HandlerMap<>();

    /**
     * Add a handler to the bag.
     *
     * @return a {@link HandlerId} which removes the handler when closed or discarded.
     */
    public HandlerId add(final F handler) {
        return this.handlers.register(handler);
    }

    /**
     * Remove every handler from the bag and pass each one to the applicator.
     * <p>
     * If the applicator throws, the exception propagates and the handlers not yet passed to it are dropped.
     */
    public void call(final Consumer<? super F> applicator) {
        Objects.requireNonNull(applicator, "applicator");
        for (final F handler : this.handlers.drain()) {
            applicator.accept(handler);
        }
    }

    public int size() {
        return this.handlers.size();
    }

    @Override
    public String toString() {
        return "BagOnce{handlers=" + size() + "}";
    }

    public static void callSimple(final BagOnce<? extends Runnable> bag) {
        bag.call(Runnable::run);
    }

    public static <A1> void callSimple(final BagOnce<? extends Consumer<? super A1>> bag, final A1 a1) {
        bag.call(h -> h.accept(a1));
    }

    public static <A1, A2> void callSimple(final BagOnce<? extends BiConsumer<? super A1, ? super A2>> bag,
                                           final A1 a1, final A2 a2) {
        bag.call(h -> h.accept(a1, a2));
    }

    public static <A1, A2, A3> void callSimple(
            final BagOnce<? extends Handler3<? super A1, ? super A2, ? super A3>> bag,
            final A1 a1, final A2 a2, final A3 a3) {
        bag.call(h -> h.accept(a1, a2, a3));
    }

    public static <A1, A2, A3, A4> void callSimple(
            final BagOnce<? extends Handler4<? super A1, ? super A2, ? super A3, ? super A4>> bag,
            final A1 a1, final A2 a2, final A3 a3, final A4 a4) {
        bag.call(h -> h.accept(a1, a2, a3, a4));
    }

    public static <A1, A2, A3, A4, A5> void callSimple(
            final BagOnce<? extends Handler5<? super A1, ? super A2, ? super A3, ? super A4, ? super A5>> bag,
            final A1 a1, final A2 a2, final A3 a3, final A4 a4, final A5 a5) {
        bag.call(h -> h.accept(a1, a2, a3, a4, a5));
    }
}
