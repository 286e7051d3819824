package org.pharmaguard.utils;

import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.pharmaguard.testutils.PgxBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class LoggingUtilsTest extends PgxBaseTest {

    @DataProvider(name = "levels")
    public Object[][] levels() {
        return new Object[][]{
                {Log.LogLevel.DEBUG, Level.DEBUG},
                {Log.LogLevel.INFO, Level.INFO},
                {Log.LogLevel.WARNING, Level.WARN},
                {Log.LogLevel.ERROR, Level.ERROR},
        };
    }

    @Test(dataProvider = "levels")
    public void testLevelMapping(final Log.LogLevel verbosity, final Level log4jLevel) {
        Assert.assertEquals(LoggingUtils.levelToLog4jLevel(verbosity), log4jLevel);
        Assert.assertEquals(LoggingUtils.levelFromLog4jLevel(log4jLevel), verbosity);
    }

    @Test
    public void testUnmappedLog4jLevel() {
        Assert.assertNull(LoggingUtils.levelFromLog4jLevel(Level.TRACE));
    }

    @Test
    public void testSetLoggingLevel() {
        try {
            LoggingUtils.setLoggingLevel(Log.LogLevel.DEBUG);
            Assert.assertTrue(LogManager.getLogger(LoggingUtilsTest.class).isDebugEnabled());
            LoggingUtils.setLoggingLevel(Log.LogLevel.ERROR);
            Assert.assertFalse(LogManager.getLogger(LoggingUtilsTest.class).isWarnEnabled());
        } finally {
            LoggingUtils.setLoggingLevel(Log.LogLevel.WARNING);
        }
    }
}
