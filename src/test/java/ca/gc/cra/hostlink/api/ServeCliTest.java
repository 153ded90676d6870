package ca.gc.cra.hostlink.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ServeCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
    logger = (Logger) LoggerFactory.getLogger(ServeCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
    System.clearProperty(TelemetryConfigurator.EXPORTER_PROPERTY);
    System.clearProperty(TelemetryConfigurator.ENDPOINT_PROPERTY);
    System.clearProperty(TelemetryConfigurator.RESOURCE_PROPERTY);
  }

  @Test
  void dryRunPrintsThePlanWithoutBinding() {
    ExitCode code = ServeCli.run(new String[] {
        "listen=127.0.0.1:0", "workers=3", "metricsExporter=none", "downloadDir=" + tempDir, "--dry-run"},
        Map.of());

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Serve dry-run"), output);
    assertTrue(output.contains("127.0.0.1:0"), output);
    assertTrue(output.contains("Workers          : 3"), output);
    assertTrue(output.contains("Metrics exporter : none"), output);
  }

  @Test
  void environmentSuppliesPortBelowYamlAndCli() throws Exception {
    Path yaml = tempDir.resolve("hostlink.yaml");
    Files.writeString(yaml, "serve:\n  workers: 4\n");

    ExitCode code = ServeCli.run(new String[] {
        "config=" + yaml, "metricsExporter=none", "--dry-run"},
        Map.of("HOSTLINK_PORT", "9100", "HOSTLINK_WORKERS", "9"));

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("localhost:9100"), buffer.toString());
    assertTrue(buffer.toString().contains("Workers          : 4"), buffer.toString());
  }

  @Test
  void invalidValuesPrintUsage() {
    ExitCode code = ServeCli.run(new String[] {"workers=0", "metricsExporter=none", "--dry-run"}, Map.of());

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: serve"));
    assertTrue(appender.list.stream().anyMatch(event -> event.getFormattedMessage().contains("workers")));
  }

  @Test
  void unknownExporterIsRejected() {
    ExitCode code = ServeCli.run(new String[] {"metricsExporter=prometheus", "--dry-run"}, Map.of());

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void missingConfigFileIsRejected() {
    ExitCode code = ServeCli.run(new String[] {
        "config=" + tempDir.resolve("absent.yaml"), "--dry-run"}, Map.of());

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void bindFailureIsAnIoError() throws Exception {
    try (java.net.ServerSocket occupied =
        new java.net.ServerSocket(0, 1, java.net.InetAddress.getLoopbackAddress())) {
      ExitCode code = ServeCli.run(new String[] {
          "listen=127.0.0.1:" + occupied.getLocalPort(), "metricsExporter=none", "shutdownGraceMs=100",
          "downloadDir=" + tempDir}, Map.of());

      assertEquals(ExitCode.IO_ERROR, code);
    }
  }
}
