package com.propertyBot.ratingsBot.orchestrator.service;

import com.propertyBot.ratingsBot.delivery.model.MessageSink;
import com.propertyBot.ratingsBot.delivery.service.ChunkedDelivery;
import com.propertyBot.ratingsBot.gateway.model.BotCommand;
import com.propertyBot.ratingsBot.gateway.model.RequestContext;
import com.propertyBot.ratingsBot.orchestrator.model.MainMenu;
import com.propertyBot.ratingsBot.orchestrator.model.MenuAction;
import com.propertyBot.ratingsBot.orchestrator.prompt.BotTexts;
import com.propertyBot.ratingsBot.property.model.ComplaintRecord;
import com.propertyBot.ratingsBot.property.model.PropertyRecord;
import com.propertyBot.ratingsBot.property.model.RankedEntry;
import com.propertyBot.ratingsBot.property.service.PropertyDataService;
import com.propertyBot.ratingsBot.property.service.PropertyRanker;
import com.propertyBot.ratingsBot.report.service.RatingsChartRenderer;
import com.propertyBot.ratingsBot.report.service.ReportFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Runs one command or menu action end to end.
 *
 * Workflow per data command:
 * FETCH -> (RANK -> RENDER CHART) -> FORMAT -> DELIVER
 *
 * Every run works on request-local data only; nothing is cached between runs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommandOrchestrator {

    static final int TOP_SHORT_LIMIT = 5;
    static final int TOP_LONG_LIMIT = 20;

    private final PropertyDataService propertyDataService;
    private final PropertyRanker propertyRanker;
    private final ReportFormatter reportFormatter;
    private final RatingsChartRenderer chartRenderer;
    private final ChunkedDelivery chunkedDelivery;

    /**
     * Dispatches a parsed command.
     *
     * @param command command to run
     * @param args    whitespace-separated arguments after the command name
     * @param context request context
     * @param sink    outbound channel
     */
    public void handleCommand(BotCommand command, List<String> args, RequestContext context, MessageSink sink) {
        log.info("Handling command - correlationId: {}, command: {}, args: {}",
                context.getCorrelationId(), command, args);
        switch (command) {
            case START -> sink.sendMenu(BotTexts.WELCOME, MainMenu.keyboard());
            case MENU -> sink.sendMenu(BotTexts.MAIN_MENU, MainMenu.keyboard());
            case RATINGS -> sendRatings(context, sink);
            case TOP5 -> sendTopRated(TOP_SHORT_LIMIT, context, sink);
            case TOP20 -> sendTopRated(TOP_LONG_LIMIT, context, sink);
            case PROPERTIES -> sendPropertiesList(context, sink);
            case PROPERTY -> sendPropertyDetails(firstArg(args), context, sink);
            case COMPLAINTS -> sendComplaints(firstArg(args), context, sink);
        }
    }

    /**
     * Runs a menu button action. Data actions share their command's code path.
     */
    public void handleAction(MenuAction action, RequestContext context, MessageSink sink) {
        log.info("Handling menu action - correlationId: {}, action: {}", context.getCorrelationId(), action);
        switch (action) {
            case TOP5 -> sendTopRated(TOP_SHORT_LIMIT, context, sink);
            case TOP20 -> sendTopRated(TOP_LONG_LIMIT, context, sink);
            case RATINGS -> sendRatings(context, sink);
            case PROPERTIES -> sendPropertiesList(context, sink);
            case PROPERTY_HELP -> sink.sendText(BotTexts.PROPERTY_HELP);
            case COMPLAINTS_HELP -> sink.sendText(BotTexts.COMPLAINTS_HELP);
        }
    }

    void sendRatings(RequestContext context, MessageSink sink) {
        List<PropertyRecord> properties = propertyDataService.fetchAllProperties(context.getCorrelationId());
        if (properties.isEmpty()) {
            sink.sendText(BotTexts.NO_RATINGS_DATA);
            return;
        }
        chunkedDelivery.deliver(reportFormatter.ratingsReport(properties), sink, context.getCorrelationId());
    }

    void sendTopRated(int limit, RequestContext context, MessageSink sink) {
        String correlationId = context.getCorrelationId();
        List<PropertyRecord> properties = propertyDataService.fetchAllProperties(correlationId);
        if (properties.isEmpty()) {
            sink.sendText(BotTexts.NO_PROPERTY_DATA);
            return;
        }

        List<RankedEntry> ranked = propertyRanker.rank(properties, limit);
        if (ranked.isEmpty()) {
            sink.sendText(BotTexts.RANKING_FAILED);
            return;
        }
        // Heading, title and caption use the returned size; fewer properties than the limit is normal
        int count = ranked.size();
        log.debug("Ranked properties - correlationId: {}, requested: {}, returned: {}", correlationId, limit, count);

        chunkedDelivery.deliver(reportFormatter.topReport(ranked), sink, correlationId);

        byte[] chart = chartRenderer.render(ranked, BotTexts.chartTitle(count));
        if (chart.length == 0) {
            log.warn("Chart rendering produced no image, skipping photo - correlationId: {}", correlationId);
            return;
        }
        sink.sendPhoto(chart, BotTexts.chartCaption(count));
    }

    void sendPropertiesList(RequestContext context, MessageSink sink) {
        List<PropertyRecord> properties = propertyDataService.fetchPropertiesList(context.getCorrelationId());
        if (properties.isEmpty()) {
            sink.sendText(BotTexts.NO_PROPERTIES);
            return;
        }
        chunkedDelivery.deliver(reportFormatter.propertiesReport(properties), sink, context.getCorrelationId());
    }

    void sendPropertyDetails(Optional<String> propertyId, RequestContext context, MessageSink sink) {
        if (propertyId.isEmpty()) {
            sink.sendText(BotTexts.PROPERTY_USAGE);
            return;
        }
        String id = propertyId.get();
        Optional<PropertyRecord> property = propertyDataService.fetchPropertyById(id, context.getCorrelationId());
        if (property.isEmpty() || property.get().isEmpty()) {
            sink.sendText(BotTexts.propertyNotFound(id));
            return;
        }
        chunkedDelivery.deliver(reportFormatter.formatProperty(property.get()), sink, context.getCorrelationId());
    }

    void sendComplaints(Optional<String> propertyId, RequestContext context, MessageSink sink) {
        if (propertyId.isEmpty()) {
            sink.sendText(BotTexts.COMPLAINTS_USAGE);
            return;
        }
        if (!propertyDataService.isComplaintsConfigured()) {
            sink.sendText(BotTexts.COMPLAINTS_NOT_CONFIGURED);
            return;
        }

        String id = propertyId.get();
        String correlationId = context.getCorrelationId();
        Optional<PropertyRecord> property = propertyDataService.fetchPropertyById(id, correlationId);
        if (property.isEmpty() || property.get().isEmpty()) {
            sink.sendText(BotTexts.propertyNotFound(id));
            return;
        }

        List<ComplaintRecord> complaints = propertyDataService.fetchComplaints(id, correlationId);
        String propertyName = property.get().name("Property " + id);
        if (complaints.isEmpty()) {
            sink.sendText(BotTexts.noComplaints(propertyName, id));
            return;
        }
        chunkedDelivery.deliver(reportFormatter.complaintsReport(propertyName, id, complaints), sink, correlationId);
    }

    private static Optional<String> firstArg(List<String> args) {
        if (args == null || args.isEmpty() || args.get(0).isBlank()) {
            return Optional.empty();
        }
        return Optional.of(args.get(0));
    }
}
