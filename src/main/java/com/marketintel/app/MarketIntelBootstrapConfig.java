package com.marketintel.app;

import com.marketintel.app.properties.DbProperties;
import com.marketintel.chat.ChatService;
import com.marketintel.config.Config;
import com.marketintel.core.ResilientCaller;
import com.marketintel.llm.LangChainTextGenerator;
import com.marketintel.pipeline.PipelineOrchestrator;
import com.marketintel.store.Database;
import com.marketintel.store.MigrationRunner;
import com.marketintel.store.RunStateStore;
import com.marketintel.store.SqliteRunStateStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.util.Map;

@Configuration
@EnableConfigurationProperties({DbProperties.class})
public class MarketIntelBootstrapConfig {
    @Bean
    public Config marketIntelConfig(Environment environment) {
        Map<String, Object> rawProperties = Binder.get(environment)
                .bind("", Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of);
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        return Config.fromConfigurationProperties(workingDir, rawProperties);
    }

    @Bean
    @Lazy
    public Database database(Config config, DbProperties dbProperties) {
        String raw = firstNonBlank(
                System.getenv("MARKETINTEL_DB_PATH"),
                dbProperties == null ? null : dbProperties.getPath(),
                config.getString("db.path", "outputs/marketintel.db")
        );
        Database database = new Database(config.workingDir().resolve(raw).normalize());
        try {
            new MigrationRunner().run(database);
        } catch (Exception e) {
            throw new IllegalStateException("Database migration failed: " + e.getMessage(), e);
        }
        return database;
    }

    @Bean
    @Lazy
    public RunStateStore runStateStore(Database database) {
        return new SqliteRunStateStore(database);
    }

    @Bean
    @Lazy
    public ResilientCaller resilientCaller(Config config) {
        return new ResilientCaller(config);
    }

    @Bean
    @Lazy
    public PipelineOrchestrator pipelineOrchestrator(Config config, RunStateStore store, ResilientCaller caller) {
        return PipelineOrchestrator.create(config, store, caller);
    }

    @Bean
    @Lazy
    public ChatService chatService(Config config, RunStateStore store) {
        return new ChatService(store, new LangChainTextGenerator(config));
    }

    private String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}
