package ca.gc.cra.hostlink.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void parseHostPortHandlesHostname() {
    assertEquals(new Net.HostPort("example.com", 443), Net.parseHostPort("example.com:443", false));
  }

  @Test
  void parseHostPortHandlesIpv4() {
    assertEquals(new Net.HostPort("10.0.0.1", 80), Net.parseHostPort("10.0.0.1:80", false));
  }

  @Test
  void parseHostPortHandlesIpv6() {
    assertEquals(new Net.HostPort("2001:db8::1", 8443), Net.parseHostPort("[2001:db8::1]:8443", false));
  }

  @Test
  void parseHostPortRejectsMissingPort() {
    assertThrows(IllegalArgumentException.class, () -> Net.parseHostPort("localhost", false));
  }

  @Test
  void parseHostPortRejectsIpv6WithoutBrackets() {
    assertThrows(IllegalArgumentException.class, () -> Net.parseHostPort("2001:db8::1:443", false));
  }

  @Test
  void ephemeralPortOnlyWhenAllowed() {
    assertEquals(0, Net.parsePort("0", true));
    assertThrows(IllegalArgumentException.class, () -> Net.parsePort("0", false));
    assertThrows(IllegalArgumentException.class, () -> Net.parsePort("70000", true));
    assertThrows(IllegalArgumentException.class, () -> Net.parsePort("http", true));
  }

  @Test
  void validateHostStripsBracketsAndRejectsBadNames() {
    assertEquals("::1", Net.validateHost("[::1]"));
    assertEquals("localhost", Net.validateHost(" localhost "));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("bad_host"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("300.1.1.1"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("-leading.example"));
  }
}
