package retrain.orchestrator.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import retrain.orchestrator.error.ApiClientException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Command-line front end for a running orchestrator. Every command is a
 * call against the HTTP API; nothing touches the database directly.
 *
 * <pre>
 * retrain [--api-url URL] list [--status S] [--format table|json]
 * retrain get JOB_ID
 * retrain create --name N --image I --command ARG... --schedule CRON [--max-retries K] [--checkpoint-path P]
 * retrain delete JOB_ID [--yes]
 * retrain retry JOB_ID
 * retrain stats | health | failed | running
 * </pre>
 *
 * Exit status is 0 on success, 1 when the API call fails and 2 on a usage error.
 */
public final class RetrainCli {

    static final String DEFAULT_API_URL = "http://localhost:8080";
    static final String API_URL_ENV = "RETRAIN_API_URL";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final Set<String> FLAGS = Set.of("--yes", "-y", "--help", "-h");

    private static final String USAGE = String.join("\n",
            "Usage: retrain [--api-url URL] COMMAND [ARGS]",
            "",
            "Commands:",
            "  list [--status STATUS] [--format table|json]   List training jobs",
            "  get JOB_ID                                     Show one job",
            "  create --name NAME --image IMAGE --command ARG [--command ARG]...",
            "         --schedule CRON [--max-retries N] [--checkpoint-path PATH]",
            "                                                 Register a job",
            "  delete JOB_ID [--yes]                          Delete a job",
            "  retry JOB_ID                                   Re-arm a finished job",
            "  stats                                          Job counts by status",
            "  health                                         Orchestrator health",
            "  failed                                         Failed jobs with errors",
            "  running                                        Running jobs with elapsed time",
            "",
            "The API URL defaults to $" + API_URL_ENV + " or " + DEFAULT_API_URL + ".");

    private final PrintStream out;
    private final PrintStream err;
    private final BufferedReader in;
    private final Clock clock;
    private final String defaultApiUrl;

    public RetrainCli(PrintStream out, PrintStream err, BufferedReader in, Clock clock, String defaultApiUrl) {
        this.out = out;
        this.err = err;
        this.in = in;
        this.clock = clock;
        this.defaultApiUrl = defaultApiUrl;
    }

    public static void main(String[] args) {
        String apiUrl = System.getenv(API_URL_ENV);
        RetrainCli cli = new RetrainCli(System.out, System.err,
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                Clock.systemUTC(),
                apiUrl != null && !apiUrl.isBlank() ? apiUrl : DEFAULT_API_URL);
        System.exit(cli.run(args));
    }

    public int run(String... argv) {
        Arguments args;
        try {
            args = Arguments.parse(argv);
        } catch (UsageException e) {
            return usage(e.getMessage());
        }
        if (args.has("--help") || args.has("-h")) {
            out.println(USAGE);
            return EXIT_OK;
        }
        if (args.positional.isEmpty()) {
            return usage("missing command");
        }

        OrchestratorClient client = new OrchestratorClient(args.option("--api-url", defaultApiUrl));
        String command = args.positional.get(0);
        try {
            switch (command) {
                case "list":
                    return list(client, args);
                case "get":
                    return get(client, args);
                case "create":
                    return create(client, args);
                case "delete":
                    return delete(client, args);
                case "retry":
                    return retry(client, args);
                case "stats":
                    return stats(client);
                case "health":
                    return health(client);
                case "failed":
                    return failed(client);
                case "running":
                    return running(client);
                default:
                    return usage("unknown command: " + command);
            }
        } catch (UsageException e) {
            return usage(e.getMessage());
        } catch (ApiClientException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    private int list(OrchestratorClient client, Arguments args) {
        String format = args.option("--format", "table");
        if (!format.equals("table") && !format.equals("json")) {
            throw new UsageException("--format must be table or json");
        }
        JsonNode page = client.listJobs(args.option("--status", null));
        if (format.equals("json")) {
            out.println(pretty(client, page));
            return EXIT_OK;
        }

        JsonNode jobs = page.path("jobs");
        if (jobs.size() == 0) {
            out.println("No jobs found.");
            return EXIT_OK;
        }
        List<List<String>> rows = new ArrayList<>();
        for (JsonNode job : jobs) {
            rows.add(List.of(
                    clip(text(job, "job_id"), 12),
                    clip(text(job, "name"), 30),
                    text(job, "status"),
                    job.path("retry_count").asInt() + "/" + job.path("max_retries").asInt(),
                    timestamp(job, "started_at"),
                    timestamp(job, "completed_at")));
        }
        printTable(List.of("Job ID", "Name", "Status", "Retries", "Started", "Completed"), rows);
        out.println();
        out.println("Total: " + page.path("total").asInt() + " jobs");
        return EXIT_OK;
    }

    private int get(OrchestratorClient client, Arguments args) {
        JsonNode job = client.getJob(args.positional(1, "JOB_ID"));

        out.println("Job ID:          " + text(job, "job_id"));
        out.println("Name:            " + text(job, "name"));
        out.println("Status:          " + text(job, "status"));
        out.println("Image:           " + text(job, "image"));
        out.println("Command:         " + joinCommand(job.path("command")));
        out.println("Schedule:        " + text(job, "schedule"));
        out.println("Retries:         " + job.path("retry_count").asInt() + "/" + job.path("max_retries").asInt());
        out.println("Checkpoint path: " + text(job, "checkpoint_path"));
        out.println("Created:         " + timestamp(job, "created_at"));
        out.println("Started:         " + timestamp(job, "started_at"));
        out.println("Completed:       " + timestamp(job, "completed_at"));
        if (job.hasNonNull("error_message")) {
            out.println("Error:           " + text(job, "error_message"));
        }
        return EXIT_OK;
    }

    private int create(OrchestratorClient client, Arguments args) {
        ObjectNode body = client.mapper().createObjectNode();
        body.put("name", args.required("--name"));
        body.put("image", args.required("--image"));
        List<String> command = args.options("--command");
        if (command.isEmpty()) {
            throw new UsageException("missing option --command");
        }
        ArrayNode commandNode = body.putArray("command");
        command.forEach(commandNode::add);
        body.put("schedule", args.required("--schedule"));
        String maxRetries = args.option("--max-retries", null);
        if (maxRetries != null) {
            try {
                body.put("max_retries", Integer.parseInt(maxRetries));
            } catch (NumberFormatException e) {
                throw new UsageException("--max-retries must be an integer");
            }
        }
        String checkpointPath = args.option("--checkpoint-path", null);
        if (checkpointPath != null) {
            body.put("checkpoint_path", checkpointPath);
        }

        JsonNode job = client.createJob(body);
        out.println("Job created: " + text(job, "job_id"));
        out.println("Status: " + text(job, "status"));
        return EXIT_OK;
    }

    private int delete(OrchestratorClient client, Arguments args) {
        String jobId = args.positional(1, "JOB_ID");
        if (!args.has("--yes") && !args.has("-y") && !confirm("Delete job " + jobId + "?")) {
            err.println("Aborted.");
            return EXIT_FAILED;
        }
        client.deleteJob(jobId);
        out.println("Job " + jobId + " deleted");
        return EXIT_OK;
    }

    private int retry(OrchestratorClient client, Arguments args) {
        JsonNode job = client.retryJob(args.positional(1, "JOB_ID"));
        out.println("Job " + text(job, "job_id") + " re-armed: " + text(job, "status"));
        return EXIT_OK;
    }

    private int stats(OrchestratorClient client) {
        JsonNode stats = client.stats();
        int total = stats.path("total_jobs").asInt();
        int completed = stats.path("completed").asInt();
        int failed = stats.path("failed").asInt();

        out.println("Total jobs: " + total);
        out.println("  Pending:   " + stats.path("pending").asInt());
        out.println("  Running:   " + stats.path("running").asInt());
        out.println("  Completed: " + completed);
        out.println("  Failed:    " + failed);
        out.println("  Retrying:  " + stats.path("retrying").asInt());
        if (completed + failed > 0) {
            double rate = 100.0 * completed / (completed + failed);
            out.println(String.format(Locale.ROOT, "Success rate: %.1f%%", rate));
        }
        return EXIT_OK;
    }

    private int health(OrchestratorClient client) {
        JsonNode health;
        try {
            health = client.health();
        } catch (ApiClientException e) {
            err.println("Orchestrator is unhealthy: " + e.getMessage());
            return EXIT_FAILED;
        }
        out.println("Orchestrator is healthy");
        out.println("Status:    " + text(health, "status"));
        out.println("Backend:   " + text(health, "backend"));
        out.println("Scheduler: " + (health.path("scheduler_running").asBoolean() ? "running" : "stopped"));
        out.println("Uptime:    " + text(health, "uptime"));
        return EXIT_OK;
    }

    private int failed(OrchestratorClient client) {
        JsonNode jobs = client.listJobs("failed").path("jobs");
        if (jobs.size() == 0) {
            out.println("No failed jobs.");
            return EXIT_OK;
        }
        List<List<String>> rows = new ArrayList<>();
        for (JsonNode job : jobs) {
            rows.add(List.of(
                    clip(text(job, "job_id"), 12),
                    clip(text(job, "name"), 30),
                    job.path("retry_count").asInt() + "/" + job.path("max_retries").asInt(),
                    clip(text(job, "error_message"), 50),
                    timestamp(job, "completed_at")));
        }
        printTable(List.of("Job ID", "Name", "Retries", "Error", "Failed At"), rows);
        return EXIT_OK;
    }

    private int running(OrchestratorClient client) {
        JsonNode jobs = client.listJobs("running").path("jobs");
        if (jobs.size() == 0) {
            out.println("No running jobs.");
            return EXIT_OK;
        }
        List<List<String>> rows = new ArrayList<>();
        for (JsonNode job : jobs) {
            rows.add(List.of(
                    clip(text(job, "job_id"), 12),
                    clip(text(job, "name"), 30),
                    timestamp(job, "started_at"),
                    elapsed(job.path("started_at").asText(null))));
        }
        printTable(List.of("Job ID", "Name", "Started", "Duration"), rows);
        return EXIT_OK;
    }

    private boolean confirm(String question) {
        out.print(question + " [y/N]: ");
        out.flush();
        try {
            String answer = in.readLine();
            return answer != null && (answer.trim().equalsIgnoreCase("y") || answer.trim().equalsIgnoreCase("yes"));
        } catch (IOException e) {
            throw new ApiClientException("Cannot read confirmation", e);
        }
    }

    private int usage(String problem) {
        err.println("Error: " + problem);
        err.println(USAGE);
        return EXIT_USAGE;
    }

    private void printTable(List<String> headers, List<List<String>> rows) {
        int[] widths = new int[headers.size()];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = headers.get(i).length();
            for (List<String> row : rows) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }
        out.println(formatRow(headers, widths));
        StringBuilder rule = new StringBuilder();
        for (int width : widths) {
            if (rule.length() > 0) {
                rule.append("  ");
            }
            rule.append("-".repeat(width));
        }
        out.println(rule);
        for (List<String> row : rows) {
            out.println(formatRow(row, widths));
        }
    }

    private static String formatRow(List<String> cells, int[] widths) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                line.append("  ");
            }
            line.append(String.format("%-" + widths[i] + "s", cells.get(i)));
        }
        return line.toString().stripTrailing();
    }

    private String elapsed(String startedAt) {
        if (startedAt == null) {
            return "N/A";
        }
        try {
            Duration duration = Duration.between(Instant.parse(startedAt), clock.instant());
            if (duration.isNegative()) {
                duration = Duration.ZERO;
            }
            return String.format("%d:%02d:%02d", duration.toHours(), duration.toMinutesPart(), duration.toSecondsPart());
        } catch (DateTimeParseException e) {
            return "N/A";
        }
    }

    private static String pretty(OrchestratorClient client, JsonNode node) {
        try {
            return client.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return node.toString();
        }
    }

    private static String joinCommand(JsonNode command) {
        List<String> parts = new ArrayList<>();
        command.forEach(part -> parts.add(part.asText()));
        return String.join(" ", parts);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "N/A" : value.asText();
    }

    /** ISO timestamp trimmed to seconds */
    private static String timestamp(JsonNode node, String field) {
        String value = text(node, field);
        return value.length() > 19 ? value.substring(0, 19) : value;
    }

    private static String clip(String value, int max) {
        return value.length() > max ? value.substring(0, max) : value;
    }

    static final class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }

    /**
     * Positional words plus {@code --option value} pairs; options may repeat
     * and may also be written {@code --option=value}.
     */
    static final class Arguments {

        final List<String> positional = new ArrayList<>();
        final Map<String, List<String>> options = new LinkedHashMap<>();

        static Arguments parse(String[] argv) {
            Arguments args = new Arguments();
            for (int i = 0; i < argv.length; i++) {
                String arg = argv[i];
                if (!arg.startsWith("-") || arg.equals("-")) {
                    args.positional.add(arg);
                } else if (FLAGS.contains(arg)) {
                    args.options.computeIfAbsent(arg, k -> new ArrayList<>());
                } else if (arg.contains("=")) {
                    int eq = arg.indexOf('=');
                    args.add(arg.substring(0, eq), arg.substring(eq + 1));
                } else if (i + 1 < argv.length) {
                    args.add(arg, argv[++i]);
                } else {
                    throw new UsageException("option " + arg + " needs a value");
                }
            }
            return args;
        }

        private void add(String name, String value) {
            options.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        }

        boolean has(String name) {
            return options.containsKey(name);
        }

        String option(String name, String fallback) {
            List<String> values = options.get(name);
            return values == null || values.isEmpty() ? fallback : values.get(values.size() - 1);
        }

        List<String> options(String name) {
            return options.getOrDefault(name, List.of());
        }

        String required(String name) {
            String value = option(name, null);
            if (value == null) {
                throw new UsageException("missing option " + name);
            }
            return value;
        }

        String positional(int index, String name) {
            if (positional.size() <= index) {
                throw new UsageException("missing argument " + name);
            }
            return positional.get(index);
        }
    }
}
