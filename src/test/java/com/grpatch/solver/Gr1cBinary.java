package com.grpatch.solver;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;

/** Locates a gr1c installation for the tests which need the real tool. */
final class Gr1cBinary {
  private Gr1cBinary() {}

  static Optional<String> find() {
    String binary = EngineConfig.defaults().binary();
    if (binary.contains(File.separator)) {
      return Files.isExecutable(Path.of(binary)) ? Optional.of(binary) : Optional.empty();
    }
    String path = System.getenv("PATH");
    if (path == null) {
      return Optional.empty();
    }
    for (String directory : path.split(Pattern.quote(File.pathSeparator))) {
      if (!directory.isEmpty() && Files.isExecutable(Path.of(directory, binary))) {
        return Optional.of(binary);
      }
    }
    return Optional.empty();
  }
}
