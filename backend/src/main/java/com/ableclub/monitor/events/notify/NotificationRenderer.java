package com.ableclub.monitor.events.notify;

import com.ableclub.monitor.events.model.NotificationChannel;
import com.ableclub.monitor.events.model.NotificationObligation;
import com.ableclub.monitor.events.model.RenderedMessage;
import com.ableclub.monitor.events.model.ScrapedEvent;
import org.springframework.stereotype.Component;

@Component
public class NotificationRenderer {
    private static final String EMAIL_SUBJECT_PREFIX = "[AbleClub] New event matching \"";

    public RenderedMessage render(NotificationObligation obligation) {
        ScrapedEvent event = obligation.event();
        NotificationChannel channel = obligation.subscription().channel();
        if (channel == NotificationChannel.TELEGRAM) {
            return new RenderedMessage(null, telegramBody(event, obligation.matchedKeyword()));
        }
        return new RenderedMessage(
            EMAIL_SUBJECT_PREFIX + obligation.matchedKeyword() + "\": " + event.title(),
            emailBody(event, obligation.matchedKeyword())
        );
    }

    private String telegramBody(ScrapedEvent event, String keyword) {
        StringBuilder text = new StringBuilder();
        text.append("New AbleClub event for \"").append(keyword).append("\"\n");
        text.append(event.title());
        String dates = dateRange(event);
        if (dates != null) {
            text.append("\n").append(dates);
        }
        return text.toString();
    }

    private String emailBody(ScrapedEvent event, String keyword) {
        StringBuilder text = new StringBuilder();
        text.append("Hello,\n\n");
        text.append("A new AbleClub event matches your keyword \"").append(keyword).append("\":\n\n");
        text.append(event.title()).append("\n");
        String dates = dateRange(event);
        if (dates != null) {
            text.append(dates).append("\n");
        }
        if (event.body() != null) {
            text.append("\n").append(event.body()).append("\n");
        }
        text.append("\n").append("=".repeat(50)).append("\n");
        text.append("Sign in to AbleClub for details.\n");
        text.append("This message was sent automatically by AbleClub Monitor; please do not reply.");
        return text.toString();
    }

    private String dateRange(ScrapedEvent event) {
        if (event.startDate() == null) {
            return null;
        }
        if (event.endDate() == null) {
            return event.startDate();
        }
        return event.startDate() + " ~ " + event.endDate();
    }
}
