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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Cleaner;
import java.lang.ref.Reference;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps a registered handler in place. Returned from {@link Bag#add(Object)} and {@link BagOnce#add(Object)}.
 * <p>
 * The handler is removed when the handle is closed, or once nothing references the handle any more and it
 * has been garbage collected. {@link #detach()} keeps the handler registered for the lifetime of its
 * registry instead.
 * <p>
 * A handle may be shared between threads. Removal happens at most once no matter how many threads close it.
 * A handle does not keep its registry reachable; if the registry is gone, closing the handle does nothing.
 */
public final class HandlerId implements Disposable, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(HandlerId.class);

    /**
     * Runs removals for handles that were discarded without being closed.
     */
    private static final Cleaner CLEANER = Cleaner.create(r -> {
        Thread t = new Thread(r, "jtier-events-cleaner");
        t.setDaemon(true);
        return t;
    });

    private final long index;
    private final Removal removal;
    private final Cleaner.Cleanable cleanable;

    HandlerId(final long index, final Runnable removeHandler) {
        this.index = index;
        this.removal = new Removal(index, removeHandler);
        this.cleanable = CLEANER.register(this, this.removal);
    }

    /**
     * Prevents the handler from being removed when this handle is closed or collected.
     * Has no effect if the handler was already removed.
     */
    public void detach() {
        try {
            this.removal.disarm();
            this.cleanable.clean();
        } finally {
            // this must stay reachable until disarmed, or the cleaner may remove the handler first
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Removes the handler from its registry now, unless the handle was detached.
     */
    @Override
    public void dispose() {
        try {
            this.removal.explicit = true;
            this.cleanable.clean();
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * An alias for {@link #dispose()}
     */
    @Override
    public void close() {
        this.dispose();
    }

    @Override
    public String toString() {
        return "HandlerId{" + this.index + "}";
    }

    /**
     * Must not reference the owning {@link HandlerId}, or the cleaner would keep it reachable forever.
     */
    private static final class Removal implements Runnable {
        private final long index;
        private final AtomicReference<Runnable> action;
        private volatile boolean explicit;

        private Removal(final long index, final Runnable action) {
            this.index = index;
            this.action = new AtomicReference<>(action);
        }

        void disarm() {
            this.explicit = true;
            this.action.set(null);
        }

        @Override
        public void run() {
            final Runnable a = this.action.getAndSet(null);
            if (a == null) {
                return;
            }
            if (!this.explicit) {
                LOG.debug("HandlerId {} was discarded without being closed, removing its handler", this.index);
            }
            a.run();
        }
    }
}
