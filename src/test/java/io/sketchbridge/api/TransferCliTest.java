package io.sketchbridge.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.sketchbridge.domain.cad.Backend;
import io.sketchbridge.domain.cad.SketchInfo;
import io.sketchbridge.domain.sketch.Constraint;
import io.sketchbridge.domain.sketch.Line;
import io.sketchbridge.domain.sketch.Point2D;
import io.sketchbridge.domain.sketch.SketchDocument;
import io.sketchbridge.testutil.FakeCadClient;
import io.sketchbridge.testutil.FakeClients;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TransferCliTest {
  private StringWriter output;
  private FakeCadClient freecad;
  private FakeCadClient fusion;
  private FakeClients clients;

  @BeforeEach
  void setUp() {
    output = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(output, true));
    freecad = new FakeCadClient();
    fusion = new FakeCadClient();
    fusion.importResult = "Sketch001";
    clients = FakeClients.allUnreachable().with(Backend.FREECAD, freecad).with(Backend.FUSION, fusion);
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void copiesEverySketchAndMovesIt() {
    freecad.sketches = List.of(new SketchInfo("Base", "Base", 1, 1), new SketchInfo("Slot", "Slot", 1, 0));
    freecad.withExport(sketch("Base")).withExport(sketch("Slot"));

    ExitCode exit = run("from=freecad", "to=fusion", "dx=5", "angle=90", "pivot=origin", "strip=true", "plane=XZ");

    assertEquals(ExitCode.SUCCESS, exit);
    assertEquals(List.of("Base", "Slot"), freecad.exportRequests);
    assertEquals(2, fusion.imported.size());
    assertEquals(List.of("XZ", "XZ"), fusion.importedPlanes);
    SketchDocument moved = fusion.imported.get(0);
    assertTrue(moved.constraints().isEmpty());
    Line line = (Line) moved.primitives().get("edge");
    assertEquals(5.0, line.start().x(), 1e-9);
    assertEquals(10.0, line.end().y(), 1e-9);
    assertEquals(
        List.of("freecad_1_Base -> Sketch001", "freecad_2_Slot -> Sketch001",
            "2 of 2 sketch(es) transferred from FreeCAD to Fusion 360"),
        lines());
    assertEquals(1, freecad.disconnectCalls.get());
    assertEquals(1, fusion.disconnectCalls.get());
  }

  @Test
  void defaultsSendSketchUnchangedToXyPlane() {
    freecad.sketches = List.of(new SketchInfo("Base", "Base", 1, 1));
    SketchDocument base = sketch("Base");
    freecad.withExport(base);

    assertEquals(ExitCode.SUCCESS, run("from=FreeCAD", "to=fusion360"));
    assertEquals(base, fusion.imported.get(0));
    assertEquals(List.of("XY"), fusion.importedPlanes);
  }

  @Test
  void failedImportIsReportedAndFailsTheCommand() {
    freecad.sketches = List.of(new SketchInfo("Base", "Base", 1, 1));
    freecad.withExport(sketch("Base"));
    fusion.importFailure = new IllegalStateException("document closed");

    assertEquals(ExitCode.RUNTIME_FAILURE, run("from=freecad", "to=fusion"));
    assertTrue(lines().contains("freecad_1_Base -> FAILED"), lines().toString());
    assertEquals(0, fusion.openCalls.get());
  }

  @Test
  void emptySourceIsNotAnError() {
    assertEquals(ExitCode.SUCCESS, run("from=freecad", "to=fusion"));
    assertEquals(List.of("No sketches in FreeCAD"), lines());
    assertTrue(freecad.exportRequests.isEmpty());
  }

  @Test
  void unreachableTargetStopsBeforeCollecting() {
    assertEquals(ExitCode.UNREACHABLE, run("from=freecad", "to=inventor"));
    assertEquals(List.of("FreeCAD      connected    Connected", "Inventor     disconnected"), lines());
    assertTrue(freecad.exportRequests.isEmpty());
    assertEquals(1, freecad.disconnectCalls.get());
  }

  @Test
  void rejectsMissingOrSameBackendsAndBadTransform() {
    assertEquals(ExitCode.INVALID_ARGS, run("to=fusion"));
    assertEquals(ExitCode.INVALID_ARGS, run("from=fusion", "to=fusion"));
    assertEquals(ExitCode.INVALID_ARGS, run("from=freecad", "to=fusion", "angle=ninety"));
    assertEquals(ExitCode.INVALID_ARGS, run("from=freecad", "to=fusion", "pivot=corner"));
    assertEquals(ExitCode.INVALID_ARGS, run("from=freecad", "to=fusion", "strip=maybe"));
    assertEquals(0, freecad.connectCalls.get());
  }

  private ExitCode run(String... args) {
    String[] withExporter = Arrays.copyOf(args, args.length + 1);
    withExporter[args.length] = "metricsExporter=none";
    return TransferCli.run(withExporter, config -> clients.asPorts());
  }

  private List<String> lines() {
    return output.toString().lines().toList();
  }

  private static SketchDocument sketch(String name) {
    return new SketchDocument(
        name,
        Map.of("edge", new Line(new Point2D(0, 0), new Point2D(10, 0))),
        List.of(Constraint.geometric("Horizontal", "edge")),
        null);
  }
}
