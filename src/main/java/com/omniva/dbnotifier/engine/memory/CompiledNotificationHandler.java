package com.omniva.dbnotifier.engine.memory;

import com.omniva.dbnotifier.engine.NotificationPublisher;
import com.omniva.dbnotifier.engine.fault.DbNotifierFatalError;
import com.omniva.dbnotifier.messaging.model.ChangeNotification;
import com.omniva.dbnotifier.messaging.model.NotificationCodec;
import com.omniva.dbnotifier.synthesis.ColumnSelector;
import com.omniva.dbnotifier.synthesis.HandlerPlan;

import java.util.Map;

/**
 * A {@link HandlerPlan} lowered into an executable in-memory trigger function: select the
 * columns, wrap them in the notification envelope, publish to the plan's channel.
 */
public class CompiledNotificationHandler implements RowEventHandler {

    private final HandlerPlan plan;
    private final NotificationCodec codec;
    private final NotificationPublisher publisher;

    public CompiledNotificationHandler(HandlerPlan plan, NotificationCodec codec, NotificationPublisher publisher) {
        this.plan = plan;
        this.codec = codec;
        this.publisher = publisher;
    }

    @Override
    public void handle(RowEvent event) {
        if (event.type() == null) {
            throw new DbNotifierFatalError("Unsupported trigger event for notifications.");
        }

        Map<String, Object> data = ColumnSelector.select(plan.columnPolicy(), event.type(), event.oldRow(), event.newRow());

        ChangeNotification notification = ChangeNotification.builder()
                .name(plan.notifName())
                .table(event.tableName())
                .event(event.type())
                .timestamp(event.transactionTimestamp())
                .data(data)
                .build();

        publisher.publish(plan.channelName(), codec.encode(notification));
    }
}
