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

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Shows how an object exposes its events by composing bags.
 */
public class EventHostExampleTest {

    static class Connection {
        private final Bag<Consumer<String>> onMessage = new Bag<>();
        private final Bag<BiConsumer<String, String>> onHeader = new Bag<>();
        private final BagOnce<Runnable> onClose = new BagOnce<>();

        HandlerId onMessage(final Consumer<String> handler) {
            return this.onMessage.add(handler);
        }

        HandlerId onHeader(final BiConsumer<String, String> handler) {
            return this.onHeader.add(handler);
        }

        HandlerId onClose(final Runnable handler) {
            return this.onClose.add(handler);
        }

        void receive(final String name, final String value) {
            Bag.callSimple(this.onHeader, name, value);
        }

        void receive(final String message) {
            Bag.callSimple(this.onMessage, message);
        }

        void close() {
            BagOnce.callSimple(this.onClose);
        }
    }

    @Test
    public void testSubscriberLifecycle() throws Exception {
        final Connection connection = new Connection();
        final List<String> log = new ArrayList<>();

        connection.onClose(() -> log.add("closed")).detach();
        connection.onHeader((name, value) -> log.add(name + "=" + value)).detach();

        try (HandlerId ignored = connection.onMessage(m -> log.add("message " + m))) {
            connection.receive("one");
            connection.receive("content-type", "text/plain");
        }
        connection.receive("two");

        connection.close();
        connection.close();

        assertThat(log).containsExactly("message one", "content-type=text/plain", "closed");
    }
}
