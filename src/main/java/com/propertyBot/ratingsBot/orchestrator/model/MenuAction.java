package com.propertyBot.ratingsBot.orchestrator.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Main menu buttons and the callback data each one carries.
 */
public enum MenuAction {
    TOP5("🏆 Top 5", "action_top5"),
    TOP20("📈 Top 20", "action_top20"),
    RATINGS("📊 All Ratings", "action_ratings"),
    PROPERTIES("🏠 Properties", "action_properties"),
    PROPERTY_HELP("🔍 Property Details", "action_property_help"),
    COMPLAINTS_HELP("📋 Complaints", "action_complaints_help");

    private final String label;
    private final String callbackData;

    MenuAction(String label, String callbackData) {
        this.label = label;
        this.callbackData = callbackData;
    }

    public String getLabel() {
        return label;
    }

    public String getCallbackData() {
        return callbackData;
    }

    public static Optional<MenuAction> fromCallbackData(String data) {
        if (data == null) {
            return Optional.empty();
        }
        String trimmed = data.trim();
        return Arrays.stream(values())
                .filter(action -> action.callbackData.equals(trimmed))
                .findFirst();
    }
}
