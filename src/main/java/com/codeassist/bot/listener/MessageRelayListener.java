package com.codeassist.bot.listener;

import com.codeassist.bot.relay.ChatRelayService;
import com.codeassist.bot.router.InboundMessage;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.channel.ChannelType;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relays direct messages, and guild messages that mention the bot, through
 * the same pipeline as slash commands.
 */
public class MessageRelayListener extends ListenerAdapter {
    private static final Logger LOGGER = LoggerFactory.getLogger(MessageRelayListener.class);

    private final ChatRelayService relayService;

    public MessageRelayListener(ChatRelayService relayService) {
        this.relayService = relayService;
    }

    @Override
    public void onMessageReceived(MessageReceivedEvent event) {
        Message message = event.getMessage();
        if (message.getAuthor().isBot() || event.isWebhookMessage()) {
            return;
        }
        boolean direct = event.isFromType(ChannelType.PRIVATE);
        if (!direct && !message.getMentions().isMentioned(event.getJDA().getSelfUser())) {
            return;
        }

        String content = stripSelfMention(message.getContentRaw(), event.getJDA().getSelfUser().getId());
        String locale = direct ? null : event.getGuild().getLocale().getLocale();
        InboundMessage inbound = InboundMessage.parse(message.getAuthor().getId(), content, locale);
        ReplySender sender = new ReplySender(text -> event.getChannel().sendMessage(text));

        event.getChannel().sendTyping().queue();
        relayService.handle(inbound).whenComplete((chunks, error) -> {
            if (error != null) {
                LOGGER.error("Failed to relay message {} from {}", message.getId(), inbound.userKey(), error);
                sender.sendAll(relayService.errorReply(inbound));
                return;
            }
            sender.sendAll(chunks);
        });
    }

    static String stripSelfMention(String content, String selfId) {
        if (content == null) {
            return "";
        }
        return content.replace("<@" + selfId + ">", "")
                .replace("<@!" + selfId + ">", "")
                .strip();
    }
}
