package com.gentoro.lawmcp.mcp;

import com.gentoro.lawmcp.exception.ExceptionUtil;
import com.gentoro.lawmcp.exception.LawMcpException;
import com.gentoro.lawmcp.exception.ValidationException;
import com.gentoro.lawmcp.service.LawQueryService;
import com.gentoro.lawmcp.statute.StructuringOptions;
import com.gentoro.lawmcp.utility.JacksonUtility;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * The MCP tools of the server. Every tool answers with pretty-printed JSON; failures come back as
 * {@code isError} results carrying the error details.
 */
public class LawTools {
  private static final org.slf4j.Logger log =
      com.gentoro.lawmcp.logging.LoggingService.getLogger(LawTools.class);

  private final LawQueryService service;

  public LawTools(LawQueryService service) {
    this.service = service;
  }

  public List<McpServerFeatures.SyncToolSpecification> specifications() {
    return List.of(
        tool(
            "search_law",
            "Search Taiwan laws by name; returns the matching law or suggestions.",
            props(
                "name", string("Law name or part of it, e.g. 民法"),
                "max_suggestions", integer("Maximum number of suggestions (default 5)")),
            List.of("name"),
            a -> service.searchLaw(a.requiredString("name"), a.optionalInt("max_suggestions"))),
        tool(
            "get_law_pcode",
            "Look up the law code (pcode) of a law by its name.",
            props("name", string("Law name")),
            List.of("name"),
            a -> service.lookupPcode(a.requiredString("name"))),
        tool(
            "validate_pcode",
            "Check whether a law code (pcode) exists.",
            props("pcode", string("Law code, e.g. B0000001")),
            List.of("pcode"),
            a -> service.validatePcode(a.requiredString("pcode"))),
        tool(
            "get_full_law",
            "Full text of a law by pcode or name, as a flat article list and a chapter tree.",
            props(
                "pcode", string("Law code"),
                "name", string("Law name, used when pcode is absent"),
                "summary_mode", bool("Keep only the first line of each article (default false)"),
                "max_articles", integer("Stop after this many articles; 0 means all (default 0)")),
            List.of(),
            a -> {
              Boolean summary = a.optionalBoolean("summary_mode");
              Integer max = a.optionalInt("max_articles");
              if (max != null && max < 0) {
                throw new ValidationException("max_articles must be >= 0, got " + max);
              }
              return service.fullLaw(
                  a.optionalString("pcode"),
                  a.optionalString("name"),
                  new StructuringOptions(summary != null && summary, max == null ? 0 : max));
            }),
        tool(
            "get_single_article",
            "Text of one article of a law.",
            props(
                "article", string("Article number, e.g. 184 or 16-1"),
                "pcode", string("Law code"),
                "name", string("Law name, used when pcode is absent")),
            List.of("article"),
            a ->
                service.singleArticle(
                    a.optionalString("pcode"),
                    a.optionalString("name"),
                    a.requiredString("article"))),
        tool(
            "search_by_keyword",
            "Find articles containing a keyword across all laws.",
            props(
                "keyword", string("Keyword to search for"),
                "max_results", integer("Maximum number of laws to report (default 10)"),
                "summary_only", bool("Report only the matching lines (default true)")),
            List.of("keyword"),
            a ->
                service.keywordSearch(
                    a.requiredString("keyword"),
                    a.optionalInt("max_results"),
                    a.optionalBoolean("summary_only"))),
        tool(
            "get_article_references",
            "Resolve the provisions an article cites (第N條第M項, 前條, ...) to their text.",
            props(
                "article", string("Article number, e.g. 16 or 16-1"),
                "pcode", string("Law code"),
                "name", string("Law name, used when pcode is absent"),
                "max_refs", integer("Maximum number of references to resolve (default 20)")),
            List.of("article"),
            a ->
                service.articleReferences(
                    a.optionalString("pcode"),
                    a.optionalString("name"),
                    a.requiredString("article"),
                    a.optionalInt("max_refs"))));
  }

  private static McpServerFeatures.SyncToolSpecification tool(
      String name,
      String description,
      Map<String, Object> properties,
      List<String> required,
      Function<ToolArguments, Object> handler) {
    return McpServerFeatures.SyncToolSpecification.builder()
        .tool(
            McpSchema.Tool.builder()
                .name(name)
                .description(description)
                .inputSchema(
                    new McpSchema.JsonSchema(
                        "object",
                        properties,
                        required,
                        false,
                        Collections.emptyMap(),
                        Collections.emptyMap()))
                .build())
        .callHandler(
            (srv, request) -> {
              try {
                Object result = handler.apply(new ToolArguments(request.arguments()));
                return new McpSchema.CallToolResult(JacksonUtility.toJson(result), false);
              } catch (LawMcpException e) {
                log.warn("Tool {} failed: {}", name, e.toString());
                return new McpSchema.CallToolResult(
                    JacksonUtility.toJson(ExceptionUtil.toErrorDetails(e)), true);
              } catch (Exception e) {
                log.error("Failed to handle MCP tool request {}", name, e);
                return new McpSchema.CallToolResult(
                    JacksonUtility.toJson(ExceptionUtil.toErrorDetails(e)), true);
              }
            })
        .build();
  }

  private static Map<String, Object> props(Object... nameAndSchema) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < nameAndSchema.length; i += 2) {
      m.put((String) nameAndSchema[i], nameAndSchema[i + 1]);
    }
    return m;
  }

  private static Map<String, Object> string(String description) {
    return Map.of("type", "string", "description", description);
  }

  private static Map<String, Object> integer(String description) {
    return Map.of("type", "integer", "description", description);
  }

  private static Map<String, Object> bool(String description) {
    return Map.of("type", "boolean", "description", description);
  }
}
