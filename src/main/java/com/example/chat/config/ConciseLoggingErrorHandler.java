package com.example.chat.config;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.listener.ConsumerRecordRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.util.backoff.BackOff;

import java.util.List;

/**
 * Logs one line per failed delivery attempt instead of a stack trace per retry.
 * Retry and recovery are left to {@link DefaultErrorHandler}.
 */
public class ConciseLoggingErrorHandler extends DefaultErrorHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConciseLoggingErrorHandler.class);

    public ConciseLoggingErrorHandler(ConsumerRecordRecoverer recoverer, BackOff backOff) {
        super(recoverer, backOff);
    }

    @Override
    public boolean handleOne(Exception thrownException, ConsumerRecord<?, ?> record, Consumer<?, ?> consumer, MessageListenerContainer container) {
        log(record, thrownException);
        return super.handleOne(thrownException, record, consumer, container);
    }

    @Override
    public void handleRemaining(Exception thrownException, List<ConsumerRecord<?, ?>> records, Consumer<?, ?> consumer, MessageListenerContainer container) {
        if (!records.isEmpty()) {
            log(records.get(0), thrownException);
        }
        super.handleRemaining(thrownException, records, consumer, container);
    }

    private void log(ConsumerRecord<?, ?> record, Exception exception) {
        LOGGER.error(
            "Error processing record. topic={}, partition={}, offset={}, exception_message='{}'",
            record.topic(),
            record.partition(),
            record.offset(),
            exception.getCause() != null ? exception.getCause().getMessage() : exception.getMessage()
        );

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Full stack trace for failed record:", exception);
        }
    }
}
