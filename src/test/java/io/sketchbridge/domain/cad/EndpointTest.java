package io.sketchbridge.domain.cad;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class EndpointTest {

  @Test
  void trimsHostAndFormatsAsHostPort() {
    Endpoint endpoint = new Endpoint(" cad01 ", 9876);
    assertEquals("cad01", endpoint.host());
    assertEquals("cad01:9876", endpoint.toString());
  }

  @Test
  void acceptsIpv6Literal() {
    Endpoint endpoint = new Endpoint("::1", 9877);
    assertEquals("::1", endpoint.host());
    assertEquals("[::1]:9877", endpoint.toString());
  }

  @Test
  void rejectsBadPortAndHost() {
    assertThrows(IllegalArgumentException.class, () -> new Endpoint("localhost", 0));
    assertThrows(IllegalArgumentException.class, () -> new Endpoint(" ", 9876));
    assertThrows(IllegalArgumentException.class, () -> new Endpoint("bad host", 9876));
  }

  @Test
  void infoRecordsApplyFallbackLabels() {
    assertEquals("Sketch", new SketchInfo("Sketch", " ", 3, 1).label());
    assertEquals("XY", new PlaneInfo("XY", null, null).name());
    assertEquals("Front (origin)", new PlaneInfo("P1", "Front", "origin").displayLabel());
    assertThrows(IllegalArgumentException.class, () -> new SketchInfo("S", "S", -1, 0));
  }
}
