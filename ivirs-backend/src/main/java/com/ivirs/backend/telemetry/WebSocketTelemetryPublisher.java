package com.ivirs.backend.telemetry;

import org.springframework.messaging.simp.SimpMessagingTemplate;

/**
 * Pushes every record to the STOMP broker so dashboards can follow the run live.
 */
public class WebSocketTelemetryPublisher implements TelemetryPublisher {

    private final SimpMessagingTemplate messagingTemplate;

    public WebSocketTelemetryPublisher(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    @Override
    public void publish(TelemetryRecord record) {
        messagingTemplate.convertAndSend(topicFor(record), record);
    }

    static String topicFor(TelemetryRecord record) {
        switch (record.recordType()) {
            case ReportRecord.TYPE:
                return "/topic/reports";
            case StatisticsRow.TYPE:
                return "/topic/statistics";
            case DispatchEvent.TYPE:
                return "/topic/dispatches";
            default:
                return "/topic/telemetry";
        }
    }
}
