package com.anonrelay.channels;

import com.anonrelay.shared.error.DeliveryException;
import com.anonrelay.shared.model.ConversationEvent;
import com.anonrelay.shared.model.MediaKind;
import com.anonrelay.shared.model.MessageContent;
import com.anonrelay.shared.model.OutboundAction;
import com.anonrelay.shared.model.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendAnimation;
import org.telegram.telegrambots.meta.api.methods.send.SendAudio;
import org.telegram.telegrambots.meta.api.methods.send.SendDocument;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.send.SendPhoto;
import org.telegram.telegrambots.meta.api.methods.send.SendSticker;
import org.telegram.telegrambots.meta.api.methods.send.SendVideo;
import org.telegram.telegrambots.meta.api.methods.send.SendVideoNote;
import org.telegram.telegrambots.meta.api.methods.send.SendVoice;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardRow;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Telegram long-polling transport. Updates are mapped to {@link InboundSink} calls on the worker
 * pool so the polling thread never blocks on relay work.
 */
public class TelegramChannel implements OutboundChannel, LongPollingSingleThreadUpdateConsumer {

    private static final Logger log = LoggerFactory.getLogger(TelegramChannel.class);
    private static final int MAX_MESSAGE_LENGTH = 4096;
    private static final int MAX_CAPTION_LENGTH = 1024;
    private static final int BUTTONS_PER_ROW = 2;

    private final String botToken;
    private final ExecutorService workers;
    private final TelegramClient telegramClient;
    private TelegramBotsLongPollingApplication bot;
    private InboundSink sink;

    public TelegramChannel(String botToken, ExecutorService workers) {
        this(botToken, workers, new OkHttpTelegramClient(botToken));
    }

    TelegramChannel(String botToken, ExecutorService workers, TelegramClient telegramClient) {
        this.botToken = botToken;
        this.workers = workers;
        this.telegramClient = telegramClient;
    }

    public void start(InboundSink sink) {
        this.sink = sink;
        try {
            bot = new TelegramBotsLongPollingApplication();
            bot.registerBot(botToken, this);
            log.info("Telegram bot started");
        } catch (Exception e) {
            throw new RuntimeException("Failed to start Telegram bot", e);
        }
    }

    public void stop() {
        if (bot != null) {
            try {
                bot.close();
            } catch (Exception e) {
                log.error("Failed to stop Telegram bot", e);
            }
        }
    }

    @Override
    public void consume(Update update) {
        if (sink == null) return;
        if (update.hasCallbackQuery()) {
            var callback = update.getCallbackQuery();
            submit(() -> handleCallback(callback));
            return;
        }
        if (!update.hasMessage()) return;
        var msg = update.getMessage();
        if (msg.getFrom() == null || !msg.isUserMessage()) return;

        long userId = msg.getFrom().getId();
        var name = displayName(msg.getFrom().getUserName(), msg.getFrom().getFirstName());
        if (msg.hasText() && msg.getText().startsWith("/start")) {
            var parts = msg.getText().trim().split("\\s+", 2);
            var payload = parts.length > 1 ? parts[1] : null;
            submit(() -> sink.onStart(userId, name, payload));
            return;
        }
        var event = toEvent(msg, userId, name);
        if (event == null) {
            log.debug("Ignoring unsupported message type from user {}", userId);
            return;
        }
        submit(() -> sink.onMessage(event));
    }

    @Override
    public Optional<String> deliver(String target, OutboundMessage message) {
        try {
            Message sent;
            if (message.media() == null) {
                sent = sendText(target, message.text(), message.replyToRef(), message.actions());
            } else {
                sent = sendMedia(target, message);
            }
            return sent == null ? Optional.empty() : Optional.of(String.valueOf(sent.getMessageId()));
        } catch (TelegramApiException e) {
            throw new DeliveryException("Telegram rejected message to " + target, e);
        }
    }

    @Override
    public void notify(String adminChannel, String text) {
        try {
            sendText(adminChannel, text, null, List.of());
        } catch (TelegramApiException e) {
            throw new DeliveryException("Telegram rejected notice to " + adminChannel, e);
        }
    }

    static ConversationEvent toEvent(Message msg, long userId, String name) {
        if (msg.hasText()) return ConversationEvent.text(userId, name, msg.getText());
        var caption = msg.getCaption();
        MessageContent.Media media = null;
        if (msg.hasPhoto()) {
            var sizes = msg.getPhoto();
            media = new MessageContent.Media(MediaKind.PHOTO, sizes.get(sizes.size() - 1).getFileId(), caption);
        } else if (msg.hasVideo()) {
            media = new MessageContent.Media(MediaKind.VIDEO, msg.getVideo().getFileId(), caption);
        } else if (msg.hasVoice()) {
            media = new MessageContent.Media(MediaKind.VOICE, msg.getVoice().getFileId(), caption);
        } else if (msg.hasVideoNote()) {
            media = new MessageContent.Media(MediaKind.VIDEO_NOTE, msg.getVideoNote().getFileId(), null);
        } else if (msg.hasAudio()) {
            media = new MessageContent.Media(MediaKind.AUDIO, msg.getAudio().getFileId(), caption);
        } else if (msg.hasAnimation()) {
            // animations also carry a document, so check them first
            media = new MessageContent.Media(MediaKind.ANIMATION, msg.getAnimation().getFileId(), caption);
        } else if (msg.hasDocument()) {
            media = new MessageContent.Media(MediaKind.DOCUMENT, msg.getDocument().getFileId(), caption);
        } else if (msg.hasSticker()) {
            media = new MessageContent.Media(MediaKind.STICKER, msg.getSticker().getFileId(), null);
        }
        return media == null ? null : ConversationEvent.media(userId, name, media);
    }

    static InlineKeyboardMarkup keyboard(List<OutboundAction> actions) {
        if (actions.isEmpty()) return null;
        var rows = new ArrayList<InlineKeyboardRow>();
        var row = new InlineKeyboardRow();
        for (var action : actions) {
            if (row.size() == BUTTONS_PER_ROW) {
                rows.add(row);
                row = new InlineKeyboardRow();
            }
            row.add(InlineKeyboardButton.builder().text(action.label()).callbackData(action.data()).build());
        }
        rows.add(row);
        return InlineKeyboardMarkup.builder().keyboard(rows).build();
    }

    private void handleCallback(CallbackQuery callback) {
        var from = callback.getFrom();
        var answer = sink.onCallback(from.getId(), displayName(from.getUserName(), from.getFirstName()),
                callback.getData());
        try {
            telegramClient.execute(AnswerCallbackQuery.builder()
                    .callbackQueryId(callback.getId())
                    .text(answer)
                    .showAlert(answer != null && answer.startsWith("❌"))
                    .build());
        } catch (TelegramApiException e) {
            log.warn("Failed to answer callback {}", callback.getId(), e);
        }
    }

    private Message sendText(String chatId, String text, String replyToRef, List<OutboundAction> actions)
            throws TelegramApiException {
        Message last = null;
        // split over 4096 chars; buttons go on the last chunk
        for (int i = 0; i < text.length(); i += MAX_MESSAGE_LENGTH) {
            var end = Math.min(i + MAX_MESSAGE_LENGTH, text.length());
            var builder = SendMessage.builder().chatId(chatId).text(text.substring(i, end));
            if (i == 0 && replyToRef != null) builder.replyToMessageId(Integer.valueOf(replyToRef));
            if (end == text.length()) builder.replyMarkup(keyboard(actions));
            last = telegramClient.execute(builder.build());
        }
        return last;
    }

    private Message sendMedia(String chatId, OutboundMessage message) throws TelegramApiException {
        var media = message.media();
        var file = new InputFile(media.fileRef());
        var text = message.text();
        var captioned = media.kind().supportsCaption() && text.length() <= MAX_CAPTION_LENGTH;
        var caption = captioned ? text : null;
        var markup = captioned ? keyboard(message.actions()) : null;
        var replyTo = message.replyToRef() != null ? Integer.valueOf(message.replyToRef()) : null;

        Message sent;
        switch (media.kind()) {
            case PHOTO:
                sent = telegramClient.execute(SendPhoto.builder().chatId(chatId).photo(file)
                        .caption(caption).replyMarkup(markup).replyToMessageId(replyTo).build());
                break;
            case VIDEO:
                sent = telegramClient.execute(SendVideo.builder().chatId(chatId).video(file)
                        .caption(caption).replyMarkup(markup).replyToMessageId(replyTo).build());
                break;
            case VOICE:
                sent = telegramClient.execute(SendVoice.builder().chatId(chatId).voice(file)
                        .caption(caption).replyMarkup(markup).replyToMessageId(replyTo).build());
                break;
            case AUDIO:
                sent = telegramClient.execute(SendAudio.builder().chatId(chatId).audio(file)
                        .caption(caption).replyMarkup(markup).replyToMessageId(replyTo).build());
                break;
            case DOCUMENT:
                sent = telegramClient.execute(SendDocument.builder().chatId(chatId).document(file)
                        .caption(caption).replyMarkup(markup).replyToMessageId(replyTo).build());
                break;
            case ANIMATION:
                sent = telegramClient.execute(SendAnimation.builder().chatId(chatId).animation(file)
                        .caption(caption).replyMarkup(markup).replyToMessageId(replyTo).build());
                break;
            case VIDEO_NOTE:
                sent = telegramClient.execute(SendVideoNote.builder().chatId(chatId).videoNote(file)
                        .replyToMessageId(replyTo).build());
                break;
            case STICKER:
                sent = telegramClient.execute(SendSticker.builder().chatId(chatId).sticker(file)
                        .replyToMessageId(replyTo).build());
                break;
            default:
                throw new DeliveryException("Unsupported media kind: " + media.kind());
        }
        if (!captioned) {
            // text and buttons follow in their own message
            sendText(chatId, text, String.valueOf(sent.getMessageId()), message.actions());
        }
        return sent;
    }

    private void submit(Runnable task) {
        try {
            workers.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool rejected update: {}", e.getMessage());
        }
    }

    private static String displayName(String userName, String firstName) {
        return userName != null ? userName : firstName;
    }
}
