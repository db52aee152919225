package io.b2mash.schemaswitch.clone;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import org.springframework.util.StreamUtils;

public class ProcessCommandExecutor implements CommandExecutor {

  @Override
  public CommandResult run(List<String> command, Map<String, String> environment)
      throws IOException, InterruptedException {
    var stderrFile = Files.createTempFile("schemaswitch-", ".stderr");
    try {
      var builder = new ProcessBuilder(command).redirectError(stderrFile.toFile());
      builder.environment().clear();
      builder.environment().putAll(environment);
      Process process = builder.start();
      process.getOutputStream().close();
      String stdout;
      try (var in = process.getInputStream()) {
        stdout = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
      }
      int exitCode = process.waitFor();
      String stderr = Files.readString(stderrFile, StandardCharsets.UTF_8);
      return new CommandResult(exitCode, stdout, stderr);
    } finally {
      Files.deleteIfExists(stderrFile);
    }
  }
}
