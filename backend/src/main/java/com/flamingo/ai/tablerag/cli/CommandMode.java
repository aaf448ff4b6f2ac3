package com.flamingo.ai.tablerag.cli;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.ApplicationArguments;

/** The three mutually exclusive ways to start the application. */
public enum CommandMode {
  INGEST("ingest"),
  APP("app"),
  QUERY("query");

  public static final String USAGE =
      """
      Usage:
        --ingest             ingest the configured report into the index
        --query="question"   answer one question from the index
        --app                start the web front-end
      Paths are read from rag.storage.* and may be overridden, e.g. --rag.storage.pdf-path=x.pdf""";

  private final String option;

  CommandMode(String option) {
    this.option = option;
  }

  public String option() {
    return option;
  }

  /**
   * Picks the single mode selected by {@code args}.
   *
   * @throws IllegalArgumentException if no mode or more than one mode is selected, or the query
   *     text is blank
   */
  public static CommandMode resolve(ApplicationArguments args) {
    List<CommandMode> selected = new ArrayList<>();
    for (CommandMode mode : values()) {
      if (args.containsOption(mode.option)) {
        selected.add(mode);
      }
    }
    if (selected.size() != 1) {
      throw new IllegalArgumentException(
          selected.isEmpty()
              ? "No mode selected"
              : "Modes are mutually exclusive, got " + selected);
    }

    CommandMode mode = selected.get(0);
    if (mode == QUERY && queryText(args).isBlank()) {
      throw new IllegalArgumentException("--query requires a question");
    }
    return mode;
  }

  /** The question passed with {@code --query}, or an empty string. */
  public static String queryText(ApplicationArguments args) {
    List<String> values = args.getOptionValues(QUERY.option);
    if (values == null || values.isEmpty()) {
      return "";
    }
    return String.join(" ", values).strip();
  }
}
