package com.propertyBot.ratingsBot.report.service;

import com.propertyBot.ratingsBot.property.model.ComplaintRecord;
import com.propertyBot.ratingsBot.property.model.PropertyRecord;
import com.propertyBot.ratingsBot.property.model.RankedEntry;
import com.propertyBot.ratingsBot.property.util.FieldResolver;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders properties, rankings and complaints as plain multi-line text for the chat channel.
 * Absent optional fields produce their default text; no formatter throws on missing keys.
 */
@Service
public class ReportFormatter {

    static final int DESCRIPTION_MAX_LENGTH = 200;
    static final String ELLIPSIS = "...";

    private static final String UNNAMED_PROPERTY = "Unnamed property";
    private static final String UNNAMED = "Unnamed";

    /**
     * Detailed single-property block, terminated by a newline.
     */
    public String formatProperty(PropertyRecord property) {
        List<String> extras = new ArrayList<>();
        property.location().ifPresent(location -> extras.add("Location: " + location));
        property.url().ifPresent(url -> extras.add("URL: " + url));
        String extraLines = extras.isEmpty() ? "" : "\n    " + String.join("\n    ", extras);

        return "🏠 " + property.name(UNNAMED_PROPERTY) + " (id: " + property.id() + ")\n"
                + "   ⭐ Airbnb: " + property.airbnbDisplay() + "\n"
                + "   ⭐ Booking: " + property.bookingDisplay()
                + extraLines + "\n";
    }

    /**
     * One listing line: id, name and location when known.
     */
    public String formatPropertyBasic(PropertyRecord property) {
        String location = property.locationOrAddress();
        String locationSuffix = location.isEmpty() ? "" : " - " + location;
        return "🏠 [" + property.id() + "] " + property.name(UNNAMED_PROPERTY) + locationSuffix;
    }

    /**
     * Ranking line with a medal for the podium and the composite score to two decimals.
     */
    public String formatRankedEntry(RankedEntry entry) {
        PropertyRecord property = entry.property();
        return rankMarker(entry.rank()) + " " + property.name(UNNAMED) + " (id: " + property.id() + ")\n"
                + "   ⭐ Avg: " + String.format(Locale.ROOT, "%.2f", entry.score())
                + " | Airbnb: " + property.airbnbDisplay()
                + " | Booking: " + property.bookingDisplay();
    }

    public String formatComplaint(ComplaintRecord complaint) {
        List<String> lines = new ArrayList<>();
        lines.add("📋 Complaint #" + complaint.id() + ": " + complaint.title());
        lines.add("   Status: " + complaint.status());
        String severity = complaint.severity();
        if (!severity.isEmpty()) {
            lines.add("   Severity: " + severity);
        }
        String date = complaint.date();
        if (!date.isEmpty()) {
            lines.add("   Date: " + date);
        }
        lines.add("   Description: " + FieldResolver.truncate(complaint.description(), DESCRIPTION_MAX_LENGTH, ELLIPSIS));
        return String.join("\n", lines);
    }

    public String rankMarker(int rank) {
        return switch (rank) {
            case 1 -> "🥇";
            case 2 -> "🥈";
            case 3 -> "🥉";
            default -> rank + ".";
        };
    }

    // Whole reports

    public String ratingsReport(List<PropertyRecord> properties) {
        List<String> lines = new ArrayList<>();
        lines.add("🏡 Property Ratings (MockAPI) \n");
        for (PropertyRecord property : properties) {
            lines.add(formatProperty(property));
        }
        return String.join("\n", lines);
    }

    /**
     * Ranking report. The heading count comes from the ranked list, not the requested limit.
     */
    public String topReport(List<RankedEntry> ranked) {
        List<String> lines = new ArrayList<>();
        lines.add("🏆 Top " + ranked.size() + " Best Rated Properties\n");
        for (RankedEntry entry : ranked) {
            lines.add(formatRankedEntry(entry));
        }
        return String.join("\n", lines);
    }

    public String propertiesReport(List<PropertyRecord> properties) {
        List<String> lines = new ArrayList<>();
        lines.add("🏠 Properties List\n");
        for (PropertyRecord property : properties) {
            lines.add(formatPropertyBasic(property));
        }
        lines.add("\n💡 Use /property <id> for details");
        lines.add("💡 Use /complaints <id> to see complaints");
        return String.join("\n", lines);
    }

    public String complaintsReport(String propertyName, String propertyId, List<ComplaintRecord> complaints) {
        List<String> lines = new ArrayList<>();
        lines.add("📋 Complaints for " + propertyName + " (id: " + propertyId + ")\n");
        lines.add("Total: " + complaints.size() + " complaint(s)\n");
        for (ComplaintRecord complaint : complaints) {
            lines.add(formatComplaint(complaint));
            lines.add("");
        }
        return String.join("\n", lines);
    }
}
