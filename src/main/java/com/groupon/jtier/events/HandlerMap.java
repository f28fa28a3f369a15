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

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lock protected storage behind {@link Bag} and {@link BagOnce}.
 * <p>
 * The lock is only ever held for a single map operation. Handler code is never run while it is held,
 * so handlers are free to add, remove and fire on the registry they are being called from.
 */
final class HandlerMap<F> {
    private static final Logger LOG = LoggerFactory.getLogger(HandlerMap.class);

    private final ReentrantLock lock = new ReentrantLock();
    private Map<Long, F> handlers = new HashMap<>();
    private long nextIndex;

    HandlerId register(final F handler) {
        Objects.requireNonNull(handler, "handler");

        final long index;
        this.lock.lock();
        try {
            index = this.nextIndex++;
            this.handlers.put(index, handler);
        } finally {
            this.lock.unlock();
        }

        LOG.trace("Registered handler {}", index);
        return new HandlerId(index, remover(new WeakReference<>(this), index));
    }

    /**
     * Builds the removal action for a handle. Static so that the action only reaches the map weakly.
     */
    private static Runnable remover(final WeakReference<HandlerMap<?>> map, final long index) {
        return () -> {
            final HandlerMap<?> target = map.get();
            if (target != null) {
                target.remove(index);
            }
        };
    }

    void remove(final long index) {
        final boolean removed;
        this.lock.lock();
        try {
            removed = this.handlers.remove(index) != null;
        } finally {
            this.lock.unlock();
        }

        if (removed) {
            LOG.debug("Removed handler {}", index);
        }
    }

    /**
     * Copies the handlers registered right now. Later changes to the map are not reflected.
     */
    List<F> snapshot() {
        this.lock.lock();
        try {
            return new ArrayList<>(this.handlers.values());
        } finally {
            this.lock.unlock();
        }
    }

    /**
     * Takes every registered handler out of the map at once, leaving it empty.
     */
    Collection<F> drain() {
        final Map<Long, F> drained;
        this.lock.lock();
        try {
            drained = this.handlers;
            this.handlers = new HashMap<>();
        } finally {
            this.lock.unlock();
        }

        LOG.trace("Drained {} handlers", drained.size());
        return drained.values();
    }

    int size() {
        this.lock.lock();
        try {
            return this.handlers.size();
        } finally {
            this.lock.unlock();
        }
    }
}
