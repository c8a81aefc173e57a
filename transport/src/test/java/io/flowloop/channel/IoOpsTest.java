/*
 * Copyright 2026 The Flowloop Project
 *
 * The Flowloop Project licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.flowloop.channel;

import org.junit.jupiter.api.Test;

import java.nio.channels.SelectionKey;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class IoOpsTest {

    @Test
    public void testSingleOpsAreCached() {
        assertSame(IoOps.NONE, IoOps.valueOf(0));
        assertSame(IoOps.READ, IoOps.valueOf(SelectionKey.OP_READ));
        assertSame(IoOps.WRITE, IoOps.valueOf(SelectionKey.OP_WRITE));
    }

    @Test
    public void testWithAndWithout() {
        IoOps both = IoOps.READ.with(IoOps.WRITE);
        assertEquals(IoOps.READ_AND_WRITE, both);
        assertTrue(both.contains(IoOps.READ));
        assertTrue(both.contains(IoOps.WRITE));
        assertFalse(IoOps.READ.contains(IoOps.READ_AND_WRITE));

        assertSame(IoOps.READ, both.without(IoOps.WRITE));
        assertSame(IoOps.NONE, IoOps.WRITE.without(IoOps.WRITE));
        assertTrue(IoOps.NONE.contains(IoOps.NONE));
    }

    @Test
    public void testUnknownOps() {
        assertThrows(IllegalArgumentException.class, () -> IoOps.valueOf(1 << 30));
    }

    @Test
    public void testToString() {
        assertEquals("IoOps(NONE)", IoOps.NONE.toString());
        assertTrue(IoOps.READ_AND_WRITE.toString().contains("READ"));
        assertTrue(IoOps.READ_AND_WRITE.toString().contains("WRITE"));
    }
}
