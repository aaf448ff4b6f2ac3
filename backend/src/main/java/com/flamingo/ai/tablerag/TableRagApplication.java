package com.flamingo.ai.tablerag;

import com.flamingo.ai.tablerag.cli.CommandMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.NestedExceptionUtils;

/** Entry point: ingest a report, answer one question, or serve the web front-end. */
@SpringBootApplication
@Slf4j
public class TableRagApplication {

  static final int EXIT_USAGE = 2;

  public static void main(String[] args) {
    CommandMode mode;
    try {
      mode = CommandMode.resolve(new DefaultApplicationArguments(args));
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.println(CommandMode.USAGE);
      System.exit(EXIT_USAGE);
      return;
    }

    SpringApplication application = new SpringApplication(TableRagApplication.class);
    application.setWebApplicationType(
        mode == CommandMode.APP ? WebApplicationType.SERVLET : WebApplicationType.NONE);

    ConfigurableApplicationContext context;
    try {
      context = application.run(args);
    } catch (RuntimeException e) {
      // Missing credentials, a missing report and index errors all surface here as root causes.
      Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
      System.err.println("❌ " + cause.getMessage());
      log.debug("Run failed", e);
      System.exit(1);
      return;
    }

    if (mode != CommandMode.APP) {
      System.exit(SpringApplication.exit(context));
    }
  }
}
