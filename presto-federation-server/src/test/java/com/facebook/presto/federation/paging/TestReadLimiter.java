/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.facebook.presto.federation.paging;

import com.facebook.presto.federation.FederationErrorCode;
import com.facebook.presto.federation.FederationException;
import org.testng.annotations.Test;

import java.util.Optional;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

public class TestReadLimiter
{
    @Test
    public void testRowLimit()
    {
        RowCountReadLimiter limiter = new RowCountReadLimiter(3);
        limiter.addRow();
        limiter.addRow();
        limiter.addRow();
        assertEquals(limiter.getRowsRead(), 3);

        try {
            limiter.addRow();
            fail("expected the read limit to be exceeded");
        }
        catch (FederationException e) {
            assertEquals(e.getErrorCode(), FederationErrorCode.READ_LIMIT_EXCEEDED);
        }
        assertEquals(limiter.getRowsRead(), 3);
    }

    @Test
    public void testFactory()
    {
        assertSame(new ReadLimiterFactory(Optional.empty()).makeReadLimiter("query"), NoOpReadLimiter.INSTANCE);

        ReadLimiterFactory factory = new ReadLimiterFactory(Optional.of(10L));
        ReadLimiter first = factory.makeReadLimiter("first");
        ReadLimiter second = factory.makeReadLimiter("second");
        assertTrue(first instanceof RowCountReadLimiter);
        for (int i = 0; i < 10; i++) {
            first.addRow();
        }
        // limiters of different requests do not share a counter
        second.addRow();
        assertEquals(((RowCountReadLimiter) second).getRowsRead(), 1);
    }

    @Test
    public void testNoOp()
    {
        for (int i = 0; i < 1000; i++) {
            NoOpReadLimiter.INSTANCE.addRow();
        }
    }
}
