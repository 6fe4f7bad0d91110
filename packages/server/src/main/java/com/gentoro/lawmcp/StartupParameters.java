package com.gentoro.lawmcp;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command line parameters in {@code --name value} form.
 *
 * <p>Modes: {@code server} (MCP over HTTP, default), {@code refs} (resolve the references of one
 * article and print them as JSON) and {@code help}.
 */
public class StartupParameters {

  static final Set<String> MODES = Set.of("server", "refs", "help");

  final Map<String, Object> parameters = new HashMap<>();

  {
    parameters.put("config-file", "classpath:application.yaml");
    parameters.put("mode", "server");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, Object> parseArguments(String[] arguments) {
    Map<String, Object> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {

      if (!arguments[p].startsWith("--")) {
        continue;
      }

      String paramName = arguments[p].substring(2);
      String paramValue = null;

      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }

      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    Object mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode.toString())) {
      throw new IllegalArgumentException("Invalid mode: " + mode);
    }

    if (parameters.get("config-file") == null
        || parameters.get("config-file").toString().isBlank()) {
      throw new IllegalArgumentException("Missing config file location");
    }

    if ("refs".equals(mode)) {
      if (getOptionalParameter("flno", String.class).filter(s -> !s.isBlank()).isEmpty()) {
        throw new IllegalArgumentException("Mode 'refs' requires --flno (e.g. 16 or 16-1)");
      }
      if (getOptionalParameter("pcode", String.class).filter(s -> !s.isBlank()).isEmpty()
          && getOptionalParameter("name", String.class).filter(s -> !s.isBlank()).isEmpty()) {
        throw new IllegalArgumentException("Mode 'refs' requires --pcode or --name");
      }
    }
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/law-mcp.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter("config-file", String.class).orElse("classpath:application.yaml");
  }

  public String mode() {
    return getParameter("mode", String.class);
  }

  public <T> T getParameter(String name, Class<T> type) {
    return type.cast(parameters.get(name));
  }

  public <T> Optional<T> getOptionalParameter(String name, Class<T> type) {
    return Optional.ofNullable(type.cast(parameters.get(name)));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }

  public static String usage() {
    return String.join(
        "\n",
        "Usage: law-mcp [--config-file <location>] [--mode server|refs|help]",
        "  --mode server                 serve MCP tools over HTTP (default)",
        "  --mode refs --flno <no>       resolve the references of one article",
        "       (--pcode <code> | --name <law name>) [--max-refs <n>] [--out <file>]",
        "  --mode help                   print this message");
  }
}
