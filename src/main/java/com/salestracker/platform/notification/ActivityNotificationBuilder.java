package com.salestracker.platform.notification;

import com.salestracker.platform.dto.Leaderboard;
import com.salestracker.platform.dto.LeaderboardEntry;
import com.salestracker.platform.dto.TeamStats;
import com.salestracker.platform.model.Activity;
import com.salestracker.platform.model.User;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the compact flex bubbles posted to chat groups.
 */
@Component
public class ActivityNotificationBuilder {

    private static final String ACCENT = "#FF6B35";
    private static final String MUTED = "#666666";
    private static final String TEXT = "#333333";

    public PushMessage buildActivityMessage(Activity activity, User user, LeaderboardEntry rank, TeamStats teamStats) {
        String displayName = user != null ? user.getDisplayName() : activity.getUserId();

        List<Map<String, Object>> header = List.of(
            text(activity.getActivityType().getEmoji() + " " + displayName, "sm", ACCENT, true, 3),
            text("+" + activity.getPoints() + " pts", "xs", MUTED, false, 1));

        List<Map<String, Object>> body = new ArrayList<>();
        body.add(text(activity.getTitle(), "sm", TEXT, false, null));
        if (activity.getSubtitle() != null && !activity.getSubtitle().isBlank()) {
            body.add(text(activity.getSubtitle(), "xs", MUTED, false, null));
        }
        body.add(separator());
        if (rank != null) {
            body.add(row("Today's rank", "#" + rank.getRank() + " (" + rank.getPoints() + " pts)"));
        }
        if (teamStats != null) {
            body.add(row("Team today", teamStats.getTodayPoints() + " pts / "
                + teamStats.getTodayActivities() + " activities"));
        }

        String altText = displayName + " logged " + activity.getTitle() + " (+" + activity.getPoints() + " pts)";
        return new PushMessage(altText, bubble(box("horizontal", header), box("vertical", body)));
    }

    public PushMessage buildLeaderboardMessage(Leaderboard leaderboard, int size) {
        List<Map<String, Object>> body = new ArrayList<>();
        long total = 0;
        for (LeaderboardEntry entry : leaderboard.getEntries()) {
            total += entry.getPoints();
            if (entry.getRank() <= size) {
                body.add(row(entry.getRank() + ". " + entry.getDisplayName(), entry.getPoints() + " pts"));
            }
        }
        body.add(separator());
        body.add(row("Team total", total + " pts"));

        String title = "Leaderboard " + leaderboard.getStartDate();
        List<Map<String, Object>> header = List.of(text("🏆 " + title, "md", ACCENT, true, null));
        return new PushMessage(title, bubble(box("vertical", header), box("vertical", body)));
    }

    private Map<String, Object> bubble(Map<String, Object> header, Map<String, Object> body) {
        Map<String, Object> bubble = new LinkedHashMap<>();
        bubble.put("type", "bubble");
        bubble.put("size", "kilo");
        bubble.put("header", header);
        bubble.put("body", body);
        return bubble;
    }

    private Map<String, Object> box(String layout, List<Map<String, Object>> contents) {
        Map<String, Object> box = new LinkedHashMap<>();
        box.put("type", "box");
        box.put("layout", layout);
        box.put("contents", contents);
        box.put("paddingAll", "md");
        return box;
    }

    private Map<String, Object> row(String label, String value) {
        Map<String, Object> valueText = text(value, "xs", ACCENT, true, null);
        valueText.put("align", "end");
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("type", "box");
        row.put("layout", "horizontal");
        row.put("contents", List.of(text(label, "xs", MUTED, false, null), valueText));
        row.put("margin", "sm");
        return row;
    }

    private Map<String, Object> text(String value, String size, String color, boolean bold, Integer flex) {
        Map<String, Object> text = new LinkedHashMap<>();
        text.put("type", "text");
        text.put("text", value);
        text.put("size", size);
        text.put("color", color);
        text.put("wrap", true);
        if (bold) {
            text.put("weight", "bold");
        }
        if (flex != null) {
            text.put("flex", flex);
        }
        return text;
    }

    private Map<String, Object> separator() {
        Map<String, Object> separator = new LinkedHashMap<>();
        separator.put("type", "separator");
        separator.put("margin", "md");
        return separator;
    }
}
