package org.cellar.indexing.mirror;

import javax.jms.Connection;
import javax.jms.ConnectionFactory;
import javax.jms.DeliveryMode;
import javax.jms.Destination;
import javax.jms.JMSException;
import javax.jms.MessageProducer;
import javax.jms.Session;
import javax.jms.TextMessage;

import org.apache.activemq.ActiveMQConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes mirror updates to an ActiveMQ queue; a {@link MirrorUpdateListener} applies them.
 *
 * <p>When the broker cannot be reached the update is handed to the fallback queue instead.</p>
 */
public class JmsMirrorUpdateQueue implements MirrorUpdateQueue {
    private static final Logger logger = LoggerFactory.getLogger(JmsMirrorUpdateQueue.class);

    private final String queueName;
    private final ConnectionFactory connectionFactory;
    private final MirrorUpdateQueue fallback;

    public JmsMirrorUpdateQueue(String brokerUrl, String queueName, MirrorUpdateQueue fallback) {
        this(new ActiveMQConnectionFactory(brokerUrl), queueName, fallback);
    }

    JmsMirrorUpdateQueue(ConnectionFactory connectionFactory, String queueName, MirrorUpdateQueue fallback) {
        this.connectionFactory = connectionFactory;
        this.queueName = queueName;
        this.fallback = fallback;
    }

    @Override
    public void submit(MirrorUpdate update) {
        try {
            send(update);
        } catch (JMSException e) {
            logger.warn("Could not publish mirror update for {} to '{}': {}. Applying it directly.",
                update.recordId(), queueName, e.getMessage());
            fallback.submit(update);
        }
    }

    private void send(MirrorUpdate update) throws JMSException {
        try (Connection connection = connectionFactory.createConnection()) {
            connection.start();
            Session session = connection.createSession(false, Session.AUTO_ACKNOWLEDGE);
            Destination destination = session.createQueue(queueName);

            MessageProducer producer = session.createProducer(destination);
            producer.setDeliveryMode(DeliveryMode.PERSISTENT);

            TextMessage message = session.createTextMessage(update.toJson());
            producer.send(message);
            logger.debug("Queued mirror {} for record {}", update.type(), update.recordId());
        }
    }

    @Override
    public void close() {
        fallback.close();
    }
}
