package com.propertyBot.ratingsBot.orchestrator.prompt;

/**
 * Fixed user-facing texts of the bot.
 */
public final class BotTexts {

    private BotTexts() {
    }

    public static final String WELCOME = """
            👋 Welcome to the Property Management Bot!

            I can help you with:
            • View property ratings (Airbnb & Booking)
            • Browse the list of properties
            • Check complaints for any property

            Use the menu below or type commands directly:""";

    public static final String MAIN_MENU = "📌 Main Menu\n\nChoose an option below:";

    public static final String NO_RATINGS_DATA = "No property data available (check MOCKAPI_URL or network).";

    public static final String NO_PROPERTY_DATA = "No property data available.";

    public static final String NO_PROPERTIES = "No properties available.";

    public static final String RANKING_FAILED = "Could not calculate ratings.";

    public static final String PROPERTY_USAGE = "Usage: /property <id>\nExample: /property 1";

    public static final String COMPLAINTS_USAGE = """
            Usage: /complaints <property_id>
            Example: /complaints 1

            This will show all complaints for the specified property.""";

    public static final String COMPLAINTS_NOT_CONFIGURED = """
            Complaints feature is not configured.
            Please set COMPLAINTS_URL in environment variables.""";

    public static final String PROPERTY_HELP = """
            🔍 Property Details

            To view details for a specific property, use:
            /property <id>

            Example: /property 1""";

    public static final String COMPLAINTS_HELP = """
            📋 View Complaints

            To see complaints for a specific property, use:
            /complaints <property_id>

            Example: /complaints 1""";

    public static String propertyNotFound(String propertyId) {
        return "Property with id " + propertyId + " not found.";
    }

    public static String noComplaints(String propertyName, String propertyId) {
        return "No complaints found for " + propertyName + " (id: " + propertyId + ").";
    }

    public static String chartTitle(int count) {
        return "Top " + count + " Properties - Ratings Comparison";
    }

    public static String chartCaption(int count) {
        return "📊 Top " + count + " Properties Rating Chart";
    }
}
