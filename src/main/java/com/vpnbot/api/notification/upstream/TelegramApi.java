package com.vpnbot.api.notification.upstream;

import lombok.NonNull;
import org.telegram.telegrambots.bots.DefaultAbsSender;
import org.telegram.telegrambots.bots.DefaultBotOptions;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

/**
 * A thin wrapper around the Telegram Bot API sender to enable easy mocking. It only sends; the
 * bot's update loop lives elsewhere.
 */
public class TelegramApi extends DefaultAbsSender {

    public TelegramApi(@NonNull DefaultBotOptions options, @NonNull String botToken) {
        super(options, botToken);
    }

    /**
     * Sends a plain text message to a private chat. For private chats, the chat id equals the
     * user's Telegram id.
     *
     * @param chatId id of the chat.
     * @param text   a not {@literal null} message text.
     * @throws TelegramApiException on api call error, e.g. when the user has blocked the bot.
     */
    public void sendMessage(long chatId, @NonNull String text) throws TelegramApiException {
        execute(SendMessage.builder()
            .chatId(String.valueOf(chatId))
            .text(text)
            .disableWebPagePreview(true)
            .build());
    }
}
