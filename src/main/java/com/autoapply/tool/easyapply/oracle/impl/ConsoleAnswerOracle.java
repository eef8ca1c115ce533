package com.autoapply.tool.easyapply.oracle.impl;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import com.autoapply.tool.easyapply.fieldprocessor.enums.FieldKind;
import com.autoapply.tool.easyapply.job.dto.JobContext;
import com.autoapply.tool.easyapply.oracle.AnswerOracle;
import com.autoapply.tool.easyapply.oracle.OracleAnswer;
import lombok.extern.slf4j.Slf4j;

/**
 * Asks the person running the tool. A blank line or closed input leaves the question
 * unresolved.
 */
@Slf4j
public class ConsoleAnswerOracle implements AnswerOracle {

  private final BufferedReader in;
  private final PrintStream out;

  public ConsoleAnswerOracle(InputStream in, PrintStream out) {
    this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    this.out = out;
  }

  @Override
  public synchronized OracleAnswer resolve(String question, FieldKind fieldKind,
      List<String> options, JobContext jobContext) {
    out.println();
    if (jobContext != null) {
      out.println("[" + jobContext.displayName() + "]");
    }
    out.println(question + " (" + fieldKind.getValue() + ")");
    if (options != null && !options.isEmpty()) {
      for (int i = 0; i < options.size(); i++) {
        out.println("  " + (i + 1) + ". " + options.get(i));
      }
      out.print("Option number or text (blank to skip): ");
    } else {
      out.print("Answer (blank to skip): ");
    }
    out.flush();

    try {
      String line = in.readLine();
      if (line == null) {
        log.debug("Console input closed, question '{}' left unresolved", question);
        return OracleAnswer.unresolved();
      }
      return OracleAnswer.of(line);
    } catch (IOException e) {
      log.warn("Could not read answer from console: {}", e.getMessage());
      return OracleAnswer.unresolved();
    }
  }

  @Override
  public String getName() {
    return "console";
  }
}
