package io.b2mash.schemaswitch.clone;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@FunctionalInterface
public interface CommandExecutor {

  CommandResult run(List<String> command, Map<String, String> environment)
      throws IOException, InterruptedException;

  record CommandResult(int exitCode, String stdout, String stderr) {

    public boolean succeeded() {
      return exitCode == 0;
    }
  }
}
