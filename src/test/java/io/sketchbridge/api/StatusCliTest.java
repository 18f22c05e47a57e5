package io.sketchbridge.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.sketchbridge.domain.cad.Backend;
import io.sketchbridge.testutil.FakeCadClient;
import io.sketchbridge.testutil.FakeClients;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StatusCliTest {
  @TempDir Path tempDir;

  private StringWriter output;
  private FakeCadClient freecad;
  private FakeClients clients;

  @BeforeEach
  void setUp() {
    output = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(output, true));
    freecad = new FakeCadClient();
    freecad.status = Map.of("active_document", "Part", "sketch_count", 2);
    clients = FakeClients.allUnreachable().with(Backend.FREECAD, freecad);
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void printsOneLinePerRequestedBackend() {
    ExitCode exit = StatusCli.run(
        new String[] {"metricsExporter=none", "backends=freecad,fusion", "connect.timeoutMillis=750"},
        config -> clients.asPorts());

    assertEquals(ExitCode.SUCCESS, exit);
    assertEquals(
        List.of("FreeCAD      connected    Part | 2 sketches", "Fusion 360   disconnected"),
        lines());
    assertEquals(List.of(Duration.ofMillis(750)), freecad.connectTimeouts);
    assertEquals(1, freecad.disconnectCalls.get());
    assertEquals(0, clients.get(Backend.FUSION).disconnectCalls.get());
  }

  @Test
  void requireAllFailsWhenAnyBackendIsDown() {
    ExitCode exit = StatusCli.run(
        new String[] {"metricsExporter=none", "--require-all"}, config -> clients.asPorts());

    assertEquals(ExitCode.UNREACHABLE, exit);
    assertEquals(4, lines().size());
  }

  @Test
  void requireAllSucceedsWhenSelectedBackendsAreUp() {
    ExitCode exit = StatusCli.run(
        new String[] {"metricsExporter=none", "backends=freecad", "--require-all"}, config -> clients.asPorts());
    assertEquals(ExitCode.SUCCESS, exit);
  }

  @Test
  void yamlSectionSelectsBackends() throws IOException {
    Path config = tempDir.resolve("bridge.yaml");
    Files.writeString(config, """
        common:
          metricsExporter: none
          backends:
            freecad:
              host: cad01
        status:
          backends: [freecad]
        """);

    ExitCode exit = StatusCli.run(new String[] {"config=" + config}, cfg -> {
      assertEquals("cad01", cfg.endpoints().get(Backend.FREECAD).host());
      return clients.asPorts();
    });

    assertEquals(ExitCode.SUCCESS, exit);
    assertEquals(List.of("FreeCAD      connected    Part | 2 sketches"), lines());
  }

  @Test
  void invalidArgumentsReturnInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS,
        StatusCli.run(new String[] {"metricsExporter=none", "backends=catia"}, config -> clients.asPorts()));
    assertEquals(ExitCode.INVALID_ARGS,
        StatusCli.run(new String[] {"metricsExporter=none", "probe.workers=0"}, config -> clients.asPorts()));
    assertEquals(ExitCode.INVALID_ARGS,
        StatusCli.run(new String[] {"stray"}, config -> clients.asPorts()));
    assertEquals(ExitCode.INVALID_ARGS,
        StatusCli.run(new String[] {"config=" + tempDir.resolve("missing.yaml")}, config -> clients.asPorts()));
    assertEquals(0, freecad.connectCalls.get());
  }

  @Test
  void malformedYamlReturnsConfigError() throws IOException {
    Path config = tempDir.resolve("broken.yaml");
    Files.writeString(config, "common: [unclosed\n");

    assertEquals(ExitCode.CONFIG_ERROR,
        StatusCli.run(new String[] {"config=" + config}, cfg -> clients.asPorts()));
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, StatusCli.run(new String[] {"--help"}, config -> clients.asPorts()));
    assertTrue(output.toString().contains("--require-all"));
  }

  @Test
  void backendLineAlignsColumns() {
    assertEquals("SolidWorks   connected    Connected",
        CliPrinter.backendLine(Backend.SOLIDWORKS, true, Map.of()));
    assertEquals("Inventor     disconnected", CliPrinter.backendLine(Backend.INVENTOR, false, Map.of()));
  }

  private List<String> lines() {
    return output.toString().lines().toList();
  }
}
