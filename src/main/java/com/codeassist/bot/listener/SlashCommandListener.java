package com.codeassist.bot.listener;

import com.codeassist.bot.config.BotConfig;
import com.codeassist.bot.relay.ChatRelayService;
import com.codeassist.bot.router.BotCommand;
import com.codeassist.bot.router.InboundMessage;
import java.util.Arrays;
import java.util.List;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.events.session.ReadyEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.InteractionHook;
import net.dv8tion.jda.api.interactions.commands.OptionMapping;
import net.dv8tion.jda.api.interactions.commands.OptionType;
import net.dv8tion.jda.api.interactions.commands.build.CommandData;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import net.dv8tion.jda.api.interactions.commands.build.SlashCommandData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SlashCommandListener extends ListenerAdapter {
    private static final Logger LOGGER = LoggerFactory.getLogger(SlashCommandListener.class);
    private static final String TEXT_OPTION = "text";

    private final BotConfig config;
    private final ChatRelayService relayService;

    public SlashCommandListener(BotConfig config, ChatRelayService relayService) {
        this.config = config;
        this.relayService = relayService;
    }

    @Override
    public void onReady(ReadyEvent event) {
        JDA jda = event.getJDA();
        List<CommandData> commands = Arrays.stream(BotCommand.values())
                .map(SlashCommandListener::toCommandData)
                .toList();

        if (config.guildId() != null) {
            Guild guild = jda.getGuildById(config.guildId());
            if (guild != null) {
                guild.updateCommands().addCommands(commands).queue();
                LOGGER.info("Registered {} commands on guild {}", commands.size(), guild.getId());
                return;
            }
            LOGGER.warn("Guild {} not found, registering commands globally", config.guildId());
        }
        jda.updateCommands().addCommands(commands).queue();
        LOGGER.info("Registered {} global commands", commands.size());
    }

    @Override
    public void onSlashCommandInteraction(SlashCommandInteractionEvent event) {
        BotCommand command = BotCommand.fromName(event.getName()).orElse(null);
        if (command == null) {
            event.reply("Unknown command.").setEphemeral(true).queue();
            return;
        }
        OptionMapping option = event.getOption(TEXT_OPTION);
        InboundMessage message = InboundMessage.command(
                event.getUser().getId(),
                command,
                option == null ? "" : option.getAsString(),
                event.getUserLocale().getLocale()
        );
        event.deferReply().queue();
        InteractionHook hook = event.getHook();
        ReplySender sender = new ReplySender(text -> hook.sendMessage(text));
        relayService.handle(message).whenComplete((chunks, error) -> {
            if (error != null) {
                LOGGER.error("Failed to handle /{} from {}", command.commandName(), message.userKey(), error);
                sender.sendAll(relayService.errorReply(message));
                return;
            }
            sender.sendAll(chunks);
        });
    }

    private static CommandData toCommandData(BotCommand command) {
        SlashCommandData data = Commands.slash(command.commandName(), command.description());
        if (command.generates()) {
            // optional so an empty invocation gets the usage hint instead of a client-side error
            data.addOption(OptionType.STRING, TEXT_OPTION, "Your request / আপনার অনুরোধ", false);
        }
        return data;
    }
}
