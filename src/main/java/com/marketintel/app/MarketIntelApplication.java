package com.marketintel.app;

import com.marketintel.chat.ChatService;
import com.marketintel.config.Config;
import com.marketintel.core.ResilientCaller;
import com.marketintel.data.ApiKeys;
import com.marketintel.data.DataSource;
import com.marketintel.data.DataSources;
import com.marketintel.data.http.HttpClientEx;
import com.marketintel.model.ChatTurn;
import com.marketintel.model.RunOutcome;
import com.marketintel.model.RunState;
import com.marketintel.pipeline.PipelineOrchestrator;
import com.marketintel.store.Database;
import com.marketintel.store.RunStateStore;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class MarketIntelApplication {
    private static volatile boolean LOG_ROUTE_INSTALLED = false;
    private static final int RECENT_RUNS_LIMIT = 10;

    public static void main(String[] args) {
        int exit = new MarketIntelApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (Exception e) {
            new HelpFormatter().printHelp("market-intel", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("market-intel", options);
            return 0;
        }

        String domain = firstNonBlank(cmd.getOptionValue("domain"), cmd.getOptionValue("market"));
        boolean analyze = !domain.isEmpty();
        boolean chat = cmd.hasOption("chat");
        boolean history = cmd.hasOption("history");
        boolean runs = cmd.hasOption("runs");
        boolean health = cmd.hasOption("health");
        if (!analyze && !chat && !history && !runs && !health) {
            new HelpFormatter().printHelp("market-intel", options);
            System.err.println("ERROR: one of --domain, --chat, --history, --runs or --health is required.");
            return 2;
        }
        if (chat && firstNonBlank(cmd.getOptionValue("message")).isEmpty()) {
            System.err.println("ERROR: --chat requires --message.");
            return 2;
        }

        try {
            Path workingDir = Path.of(".").toAbsolutePath().normalize();
            Config config = Config.load(workingDir);
            installLogRoutingIfNeeded(config);
            MarketIntelBootstrapConfig bootstrap = new MarketIntelBootstrapConfig();

            if (health) {
                return runHealth(config, bootstrap);
            }

            Database database = bootstrap.database(config, null);
            RunStateStore store = bootstrap.runStateStore(database);
            if (chat) {
                ChatService chatService = bootstrap.chatService(config, store);
                System.out.println(chatService.send(cmd.getOptionValue("chat"), cmd.getOptionValue("message")));
                return 0;
            }
            if (history) {
                ChatService chatService = bootstrap.chatService(config, store);
                for (ChatTurn turn : chatService.history(cmd.getOptionValue("history"))) {
                    System.out.println("[" + turn.timestamp() + "] " + turn.role().wireName() + ": " + turn.content());
                }
                return 0;
            }
            if (runs) {
                for (RunState state : store.listRecentRuns(RECENT_RUNS_LIMIT)) {
                    System.out.println(state.runId() + " " + state.createdAt()
                            + " domain=" + state.domain()
                            + " report=" + state.reportFile().orElse("-"));
                }
                return 0;
            }

            ResilientCaller caller = bootstrap.resilientCaller(config);
            PipelineOrchestrator orchestrator = bootstrap.pipelineOrchestrator(config, store, caller);
            RunOutcome outcome = orchestrator.run(
                    domain,
                    cmd.getOptionValue("query", ""),
                    cmd.getOptionValue("question", "")
            );
            printOutcome(outcome);
            if (outcome.success) {
                return 0;
            }
            return outcome.runId.isEmpty() ? 2 : 1;
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    private int runHealth(Config config, MarketIntelBootstrapConfig bootstrap) {
        ApiKeys apiKeys = new ApiKeys(config);
        List<String> optional = new ArrayList<>();
        boolean primaryConfigured = false;
        for (DataSource source : DataSources.defaults(config, apiKeys, new HttpClientEx(config))) {
            if (source.isPrimary()) {
                primaryConfigured = source.isConfigured();
            } else if (source.isConfigured()) {
                optional.add(source.name());
            }
        }
        String dbStatus;
        String dbPath;
        try {
            Database database = bootstrap.database(config, null);
            dbPath = database.path().toString();
            dbStatus = Files.exists(database.path()) ? "ok" : "missing";
        } catch (RuntimeException e) {
            dbPath = config.getString("db.path");
            dbStatus = "error: " + e.getMessage();
        }
        System.out.println("status=ok");
        System.out.println("db_path=" + dbPath);
        System.out.println("db_path_source=" + config.sourceOf("db.path"));
        System.out.println("db=" + dbStatus);
        System.out.println("primary_search_configured=" + primaryConfigured);
        System.out.println("optional_providers=" + (optional.isEmpty() ? "none" : String.join(",", optional)));
        return 0;
    }

    private void printOutcome(RunOutcome outcome) {
        System.out.println("success=" + outcome.success);
        System.out.println("run_id=" + outcome.runId);
        if (outcome.outputDir != null) {
            System.out.println("output_dir=" + outcome.outputDir);
        }
        if (outcome.reportFile != null) {
            System.out.println("report=" + outcome.reportFile);
        }
        if (outcome.readmeFile != null) {
            System.out.println("readme=" + outcome.readmeFile);
        }
        if (!outcome.dataFiles.isEmpty()) {
            System.out.println("data_files=" + String.join(",", outcome.dataFiles));
        }
        if (outcome.ragLogFile != null) {
            System.out.println("rag_log=" + outcome.ragLogFile);
        }
        if (outcome.answer != null) {
            System.out.println("answer=" + outcome.answer);
        }
        if (outcome.error != null) {
            System.out.println("error=" + outcome.error);
        }
        if (outcome.telemetrySummary != null) {
            System.out.println(outcome.telemetrySummary);
        }
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (MarketIntelApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("marketintel.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(MarketIntelApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder("d").longOpt("domain").hasArg().argName("domain").desc("market domain to analyze").build());
        options.addOption(Option.builder().longOpt("market").hasArg().argName("domain").desc("alias of --domain").build());
        options.addOption(Option.builder("q").longOpt("query").hasArg().argName("text").desc("focus query for the analysis").build());
        options.addOption(Option.builder().longOpt("question").hasArg().argName("text").desc("question answered from the collected data").build());
        options.addOption(Option.builder().longOpt("chat").hasArg().argName("session").desc("send --message to a chat session").build());
        options.addOption(Option.builder().longOpt("message").hasArg().argName("text").desc("chat message").build());
        options.addOption(Option.builder().longOpt("history").hasArg().argName("session").desc("print a chat session's history").build());
        options.addOption(Option.builder().longOpt("runs").desc("list recent run checkpoints").build());
        options.addOption(Option.builder().longOpt("health").desc("print configuration health").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                return value.trim();
            }
        }
        return "";
    }
}
