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

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import uk.org.lidalia.slf4jext.Level;
import uk.org.lidalia.slf4jtest.LoggingEvent;
import uk.org.lidalia.slf4jtest.TestLogger;
import uk.org.lidalia.slf4jtest.TestLoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

public class LoggingTest {

    private final TestLogger logger = TestLoggerFactory.getTestLogger(HandlerMap.class);

    @Before
    @After
    public void clearLogs() {
        TestLoggerFactory.clearAll();
    }

    @Test
    public void testRemovalIsLogged() throws Exception {
        final Bag<Runnable> bag = new Bag<>();
        bag.add(() -> {
        }).close();

        assertThat(this.logger.getLoggingEvents())
                .filteredOn(e -> e.getLevel() == Level.DEBUG)
                .extracting(LoggingEvent::getMessage)
                .containsExactly("Removed handler {}");
    }

    @Test
    public void testRemovingFiredHandlerIsNotLogged() throws Exception {
        final BagOnce<Runnable> bag = new BagOnce<>();
        final HandlerId id = bag.add(() -> {
        });
        BagOnce.callSimple(bag);
        id.close();

        assertThat(this.logger.getLoggingEvents())
                .extracting(LoggingEvent::getLevel)
                .doesNotContain(Level.DEBUG);
    }
}
