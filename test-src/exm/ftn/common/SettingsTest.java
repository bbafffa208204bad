package exm.ftn.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Test;

import exm.ftn.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @After
  public void restoreDefaults() {
    Settings.reset(Settings.INT_LITERAL_WIDTH);
    Settings.reset(Settings.LOG_TRACE);
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertEquals(Settings.DEFAULT_INT_LITERAL_WIDTH,
                 Settings.getPositiveInt(Settings.INT_LITERAL_WIDTH));
    assertEquals(Settings.DEFAULT_BOZ_MIN_WIDTH,
                 Settings.getPositiveInt(Settings.BOZ_MIN_WIDTH));
    assertFalse(Settings.getBoolean(Settings.LOG_TRACE));
    assertTrue(Settings.getKeys().contains(Settings.LOG_FILE));
  }

  @Test
  public void testOverrideAndReset() throws InvalidOptionException {
    Settings.set(Settings.INT_LITERAL_WIDTH, "32");
    assertEquals(32, Settings.getInt(Settings.INT_LITERAL_WIDTH));
    Settings.reset(Settings.INT_LITERAL_WIDTH);
    assertEquals(64, Settings.getInt(Settings.INT_LITERAL_WIDTH));
  }

  @Test(expected=InvalidOptionException.class)
  public void testNotPositive() throws InvalidOptionException {
    Settings.set(Settings.INT_LITERAL_WIDTH, "0");
    Settings.getPositiveInt(Settings.INT_LITERAL_WIDTH);
  }

  @Test(expected=InvalidOptionException.class)
  public void testNotBoolean() throws InvalidOptionException {
    Settings.set(Settings.LOG_TRACE, "yes");
    Settings.getBoolean(Settings.LOG_TRACE);
  }

  @Test
  public void testSystemPropertyOverride() throws InvalidOptionException {
    System.setProperty(Settings.LOG_TRACE, "true");
    try {
      Settings.initFTNProperties();
      assertTrue(Settings.getBoolean(Settings.LOG_TRACE));
    } finally {
      System.clearProperty(Settings.LOG_TRACE);
    }
  }

  @Test
  public void testSetupFromSettings() {
    Settings.set(Settings.LOG_TRACE, "true");
    Logger logger = Logging.setupLogging();
    assertEquals(Level.TRACE, logger.getLevel());

    Settings.reset(Settings.LOG_TRACE);
    assertEquals(Level.WARN, Logging.setupLogging().getLevel());
  }

  @Test
  public void testUniqueWarn() {
    String msg = "SettingsTest unique warning";
    Logging.uniqueWarn(msg);
    assertFalse(Logging.addEmitted(Level.WARN, msg));
  }
}
