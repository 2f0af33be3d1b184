package com.codeassist.bot;

import com.codeassist.bot.config.BotConfig;
import com.codeassist.bot.generation.GeminiHttpClient;
import com.codeassist.bot.intent.IntentClassifier;
import com.codeassist.bot.language.LanguageClassifier;
import com.codeassist.bot.language.MessageCatalog;
import com.codeassist.bot.listener.MessageRelayListener;
import com.codeassist.bot.listener.SlashCommandListener;
import com.codeassist.bot.ratelimit.RateLimitSweeper;
import com.codeassist.bot.ratelimit.SlidingWindowRateLimiter;
import com.codeassist.bot.relay.ChatRelayService;
import com.codeassist.bot.reply.ResponseChunker;
import com.codeassist.bot.router.PromptTemplates;
import com.codeassist.bot.router.RequestRouter;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.requests.GatewayIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class BotLauncher {
    private static final Logger LOGGER = LoggerFactory.getLogger(BotLauncher.class);
    private static final int DISCORD_MESSAGE_LIMIT = 2000;
    private static final int GENERATION_THREADS = 8;

    public static void main(String[] args) throws InterruptedException {
        BotConfig config;
        try {
            config = BotConfig.fromEnvironment();
        } catch (IllegalStateException error) {
            System.err.println("Bot configuration error: " + error.getMessage());
            System.err.println("Set DISCORD_TOKEN and GEMINI_API_KEY before launching the bot.");
            return;
        }

        if (config.debugMode()) {
            LOGGER.info("Settings: model={}, endpoint={}, rateLimit={}/{}s, sweep={}s, maxMessageLength={}, timeout={}s",
                    config.geminiModel(), config.geminiEndpoint(), config.rateLimitPerUser(),
                    config.rateLimitWindow().toSeconds(), config.sweepInterval().toSeconds(),
                    config.maxMessageLength(), config.requestTimeout().toSeconds());
        }

        Clock clock = Clock.systemUTC();
        SlidingWindowRateLimiter rateLimiter = new SlidingWindowRateLimiter(
                config.rateLimitPerUser(),
                config.rateLimitWindow(),
                clock
        );
        MessageCatalog messages = new MessageCatalog("/messages.json");
        RequestRouter router = new RequestRouter(
                rateLimiter,
                new LanguageClassifier(),
                new IntentClassifier(),
                messages,
                new PromptTemplates("/prompts.json"),
                config.geminiModel(),
                config.debugMode()
        );
        ExecutorService generationPool = Executors.newFixedThreadPool(GENERATION_THREADS, namedThreads());
        ChatRelayService relayService = new ChatRelayService(
                router,
                new GeminiHttpClient(config),
                messages,
                new ResponseChunker(Math.min(config.maxMessageLength(), DISCORD_MESSAGE_LIMIT)),
                generationPool,
                clock
        );
        RateLimitSweeper sweeper = new RateLimitSweeper(rateLimiter, config.sweepInterval());

        JDA jda = JDABuilder.createDefault(config.discordToken())
                .enableIntents(List.of(
                        GatewayIntent.GUILD_MESSAGES,
                        GatewayIntent.DIRECT_MESSAGES,
                        GatewayIntent.MESSAGE_CONTENT
                ))
                .addEventListeners(
                        new SlashCommandListener(config, relayService),
                        new MessageRelayListener(relayService)
                )
                .build();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutting down");
            sweeper.close();
            generationPool.shutdown();
            jda.shutdown();
        }, "shutdown"));

        jda.awaitReady();
        sweeper.start();
        LOGGER.info("Bot ready as {} using model {}", jda.getSelfUser().getName(), config.geminiModel());
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "generation-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
