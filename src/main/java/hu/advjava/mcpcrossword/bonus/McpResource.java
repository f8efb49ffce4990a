package hu.advjava.mcpcrossword.bonus;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import hu.advjava.mcpcrossword.Crossword;
import hu.advjava.mcpcrossword.CrosswordCreator;
import hu.advjava.mcpcrossword.CrosswordIO;
import hu.advjava.mcpcrossword.ExampleCrossword;
import hu.advjava.mcpcrossword.Slot;
import jakarta.json.Json;
import jakarta.json.JsonArray;
import jakarta.json.JsonArrayBuilder;
import jakarta.json.JsonObject;
import jakarta.json.JsonObjectBuilder;
import jakarta.json.JsonString;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HEAD;
import jakarta.ws.rs.OPTIONS;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.sse.OutboundSseEvent;
import jakarta.ws.rs.sse.Sse;
import jakarta.ws.rs.sse.SseEventSink;

@Path("/mcp")
public class McpResource {
    private static final Logger log = LogManager.getLogger(McpResource.class);

    static final int METHOD_NOT_FOUND = -32601;
    static final int INVALID_PARAMS = -32602;
    static final int SERVER_ERROR = -32000;

    @Context
    private Sse sse;

    /* ---- Accept GET (200) so connectors probing don't fail ---- */
    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public Response getInfo(@Context HttpHeaders headers, @Context UriInfo ui) {
        logProbe("GET", ui, headers);
        JsonObject body = Json.createObjectBuilder()
                .add("ok", true)
                .add("endpoint", "/mcp")
                .add("hint", "POST JSON-RPC here; optional SSE at GET /mcp/stream")
                .build();
        return Response.ok(body).build();
    }

    /* ---- HEAD and OPTIONS should also be 200 ---- */
    @HEAD
    public Response head(@Context HttpHeaders headers, @Context UriInfo ui) {
        logProbe("HEAD", ui, headers);
        return Response.ok().build();
    }

    // Preflight / browser convenience
    @OPTIONS
    @Path("{any: .*}")
    public Response options(@Context HttpHeaders headers, @Context UriInfo ui) {
        logProbe("OPTIONS", ui, headers);
        return Response.ok()
                .header("Access-Control-Allow-Origin", "*")
                .header("Access-Control-Allow-Headers", "Content-Type, Authorization")
                .header("Access-Control-Allow-Methods", "GET,POST,HEAD,OPTIONS")
                .build();
    }

    /* -------------------- POST (JSON, non-SSE) -------------------- */

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response handleJson(JsonObject request, @Context HttpHeaders headers, @Context UriInfo ui) {
        logProbe("POST", ui, headers);
        JsonObject resp = dispatch(request); // {"jsonrpc":"2.0", "id":..., "result"| "error":...}
        return Response.ok(resp, MediaType.APPLICATION_JSON_TYPE)
                .header("Cache-Control", "no-cache")
                .build();
    }

    /* -------------------- POST (SSE, streaming) -------------------- */

    // Same path, different negotiated media type
    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.SERVER_SENT_EVENTS)
    public void handleSse(JsonObject request, @Context SseEventSink sink) {
        sink.send(jsonRpcEvent(dispatch(request)));
        // Keep open if you will stream multiple messages; otherwise Grizzly closes it when the method returns.
    }

    /* -------------------- Optional push channel -------------------- */

    @GET
    @Path("/stream")
    @Produces(MediaType.SERVER_SENT_EVENTS)
    public void stream(@Context SseEventSink sink) {
        // Send a quick ready event so proxies see data promptly
        JsonObject ready = Json.createObjectBuilder()
                .add("jsonrpc", "2.0")
                .add("method", "server/ready")
                .add("params", Json.createObjectBuilder())
                .build();
        sink.send(jsonRpcEvent(ready));
    }

    private OutboundSseEvent jsonRpcEvent(JsonObject data) {
        return sse.newEventBuilder()
                .name("jsonrpc")
                .mediaType(MediaType.APPLICATION_JSON_TYPE)
                .data(JsonObject.class, data)
                .build();
    }

    /* -------------------- Core dispatcher -------------------- */

    public JsonObject dispatch(JsonObject request) {
        String method = request.getString("method", "");
        int id = request.getInt("id", -1);

        log.info("MCP <- {} (id={})", method, id);
        try {
            return switch (method) {
                case "initialize" -> okEnvelope(id, initialize());
                case "tools/list" -> okEnvelope(id, toolsList());
                case "tools/call" -> callTool(id, params(request));
                case "prompts/list" -> okEnvelope(id, promptsList());
                case "prompts/get" -> getPrompt(id, params(request));
                case "resources/list" -> okEnvelope(id, resourcesList());
                case "resources/read" -> readResource(id, params(request));
                default -> errorEnvelope(id, METHOD_NOT_FOUND, "Method not found: " + method);
            };
        } catch (IllegalArgumentException | ClassCastException e) {
            // StructureException included: the caller sent a grid we cannot use
            log.warn("Invalid params for {} (id={}): {}", method, id, e.getMessage());
            return errorEnvelope(id, INVALID_PARAMS, "Invalid params: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("MCP {} (id={}) failed", method, id, e);
            return errorEnvelope(id, SERVER_ERROR, "Server error: " + e.getMessage());
        }
    }

    /* ----------------------- Lifecycle ----------------------- */

    private JsonObject initialize() {
        return Json.createObjectBuilder()
                .add("protocolVersion", "2025-06-18")
                .add("capabilities", Json.createObjectBuilder()
                        .add("tools", Json.createObjectBuilder())
                        .add("prompts", Json.createObjectBuilder())
                        .add("resources", Json.createObjectBuilder()))
                .add("serverInfo", Json.createObjectBuilder()
                        .add("name", "CrosswordMCP")
                        .add("version", "1.0"))
                .add("instructions",
                        "This server fills crossword grids from word lists (solve_crossword, solve_example), " +
                        "offers a prompt (explain_fill), and exposes example puzzles as resources.")
                .build();
    }

    /* ----------------------- Tools --------------------------- */

    private JsonObject toolsList() {
        JsonObject stringArray = Json.createObjectBuilder()
                .add("type", "array")
                .add("items", Json.createObjectBuilder().add("type", "string"))
                .build();
        return Json.createObjectBuilder()
                .add("tools", Json.createArrayBuilder()
                        .add(Json.createObjectBuilder()
                                .add("name", "solve_crossword")
                                .add("description", "Fill a crossword grid. Structure rows use '_' for open cells, " +
                                        "anything else is blocked. Every word is used at most once.")
                                .add("inputSchema", Json.createObjectBuilder()
                                        .add("type", "object")
                                        .add("properties", Json.createObjectBuilder()
                                                .add("structure", stringArray)
                                                .add("words", stringArray))
                                        .add("required", Json.createArrayBuilder().add("structure").add("words"))))
                        .add(Json.createObjectBuilder()
                                .add("name", "solve_example")
                                .add("description", "Fill one of the bundled example crosswords.")
                                .add("inputSchema", Json.createObjectBuilder()
                                        .add("type", "object")
                                        .add("properties", Json.createObjectBuilder()
                                                .add("name", Json.createObjectBuilder()
                                                        .add("type", "string")
                                                        .add("enum", exampleNames())))
                                        .add("required", Json.createArrayBuilder().add("name")))))
                .build();
    }

    private JsonObject callTool(int id, JsonObject params) {
        final String toolName = params.getString("name", "");
        final JsonObject args = params.getJsonObject("arguments");
        if (args == null) throw new IllegalArgumentException("Missing arguments for " + toolName);

        return switch (toolName) {
            case "solve_crossword" -> okEnvelope(id, textContent(solve(
                    Crossword.parse(strings(args, "structure")), strings(args, "words"))));
            case "solve_example" -> {
                Optional<ExampleCrossword> example = ExampleCrossword.find(args.getString("name", ""));
                yield example.isEmpty()
                        ? errorEnvelope(id, METHOD_NOT_FOUND, "Unknown example: " + args.getString("name", ""))
                        : okEnvelope(id, textContent(solve(example.get().toCrossword(), example.get().getWords())));
            }
            default -> errorEnvelope(id, METHOD_NOT_FOUND, "Unknown tool: " + toolName);
        };
    }

    static JsonObject solve(Crossword crossword, List<String> words) {
        Optional<Map<Slot, String>> assignment = new CrosswordCreator(crossword, words).solve();
        JsonObjectBuilder res = Json.createObjectBuilder().add("solved", assignment.isPresent());
        assignment.ifPresent(a -> {
            JsonArrayBuilder slots = Json.createArrayBuilder();
            a.forEach((slot, word) -> slots.add(Json.createObjectBuilder()
                    .add("row", slot.row())
                    .add("col", slot.col())
                    .add("direction", slot.direction().name())
                    .add("length", slot.length())
                    .add("word", word)));
            res.add("grid", linesToJson(CrosswordIO.render(crossword, a).lines().toList()))
                    .add("slots", slots);
        });
        return res.build();
    }

    /* ----------------------- Prompts ------------------------- */

    private JsonObject promptsList() {
        return Json.createObjectBuilder()
                .add("prompts", Json.createArrayBuilder()
                        .add(Json.createObjectBuilder()
                                .add("name", "explain_fill")
                                .add("description", "Explain why a filled crossword satisfies its crossings.")
                                .add("arguments", Json.createArrayBuilder()
                                        .add(Json.createObjectBuilder()
                                                .add("name", "grid")
                                                .add("type", "json")))))
                .build();
    }

    private JsonObject getPrompt(int id, JsonObject params) {
        final String promptName = params.getString("name", "");
        if (!"explain_fill".equals(promptName)) {
            return errorEnvelope(id, METHOD_NOT_FOUND, "Unknown prompt: " + promptName);
        }
        // Templated messages (system + user); clients substitute the arguments.
        return okEnvelope(id, Json.createObjectBuilder()
                .add("name", "explain_fill")
                .add("messages", Json.createArrayBuilder()
                        .add(Json.createObjectBuilder()
                                .add("role", "system")
                                .add("content", "You are a crossword constructor. Be concise."))
                        .add(Json.createObjectBuilder()
                                .add("role", "user")
                                .add("content", "Here is a filled grid ('█' = blocked). Walk through each crossing " +
                                        "and confirm the shared letters match:\n{{grid}}")))
                .build());
    }

    /* ----------------------- Resources ----------------------- */

    private JsonObject resourcesList() {
        JsonArrayBuilder resources = Json.createArrayBuilder();
        for (ExampleCrossword example : ExampleCrossword.values()) {
            resources.add(Json.createObjectBuilder()
                    .add("uri", example.uri())
                    .add("name", example.getDescription())
                    .add("mimeType", "application/json"));
        }
        return Json.createObjectBuilder().add("resources", resources).build();
    }

    private JsonObject readResource(int id, JsonObject params) {
        final String uri = params.getString("uri", "");
        Optional<ExampleCrossword> example = uri.startsWith("crossword://") ? ExampleCrossword.find(uri) : Optional.empty();
        if (example.isEmpty()) {
            return errorEnvelope(id, METHOD_NOT_FOUND, "Unknown resource: " + uri);
        }

        String text = Json.createObjectBuilder()
                .add("structure", linesToJson(example.get().getStructure()))
                .add("words", linesToJson(example.get().getWords()))
                .build()
                .toString();
        return okEnvelope(id, Json.createObjectBuilder()
                .add("uri", uri)
                .add("mimeType", "application/json")
                .add("contents", Json.createArrayBuilder()
                        .add(Json.createObjectBuilder()
                                .add("uri", uri)
                                .add("mimeType", "application/json")
                                .add("text", text)))
                .build());
    }

    /* -------------------- JSON helpers -------------------- */

    private static JsonObject params(JsonObject request) {
        JsonObject params = request.getJsonObject("params");
        if (params == null) throw new IllegalArgumentException("Missing params");
        return params;
    }

    private static JsonObject textContent(JsonObject payload) {
        return Json.createObjectBuilder().add("content", Json.createArrayBuilder()
                        .add(Json.createObjectBuilder().add("type", "text").add("text", payload.toString())))
                .build();
    }

    private static JsonObject okEnvelope(int id, JsonObject result) {
        return Json.createObjectBuilder()
                .add("jsonrpc", "2.0")
                .add("id", id)
                .add("result", result)
                .build();
    }

    private static JsonObject errorEnvelope(int id, int code, String message) {
        return Json.createObjectBuilder()
                .add("jsonrpc", "2.0")
                .add("id", id)
                .add("error", Json.createObjectBuilder()
                        .add("code", code)
                        .add("message", message))
                .build();
    }

    private static List<String> strings(JsonObject args, String key) {
        JsonArray arr = args.getJsonArray(key);
        if (arr == null) throw new IllegalArgumentException("Missing '" + key + "'");
        return arr.getValuesAs(JsonString.class).stream().map(JsonString::getString).toList();
    }

    private static JsonArray linesToJson(List<String> lines) {
        JsonArrayBuilder ab = Json.createArrayBuilder();
        lines.forEach(ab::add);
        return ab.build();
    }

    private static JsonArrayBuilder exampleNames() {
        JsonArrayBuilder names = Json.createArrayBuilder();
        for (ExampleCrossword example : ExampleCrossword.values()) names.add(example.name().toLowerCase(Locale.ROOT));
        return names;
    }

    /* ---- Logging helper ---- */
    private void logProbe(String method, UriInfo ui, HttpHeaders h) {
        log.debug("{} {} Accept={} Content-Type={}", method, ui.getRequestUri(),
                h.getHeaderString("Accept"), h.getHeaderString("Content-Type"));
    }
}
