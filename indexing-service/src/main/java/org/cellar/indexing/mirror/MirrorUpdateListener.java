package org.cellar.indexing.mirror;

import javax.jms.Connection;
import javax.jms.ConnectionFactory;
import javax.jms.Destination;
import javax.jms.JMSException;
import javax.jms.Message;
import javax.jms.MessageConsumer;
import javax.jms.Session;
import javax.jms.TextMessage;

import com.google.gson.JsonParseException;
import org.apache.activemq.ActiveMQConnectionFactory;
import org.cellar.core.mirror.MirrorSynchronizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background consumer of the mirror update queue. Each message is applied through the synchronizer, so
 * failures end up in the pending-resync set rather than back on the queue.
 */
public class MirrorUpdateListener implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(MirrorUpdateListener.class);

    private static final long RECEIVE_TIMEOUT_MS = 5000;
    private static final long RECONNECT_DELAY_MS = 10000;

    private final String brokerUrl;
    private final String queueName;
    private final MirrorSynchronizer synchronizer;

    private volatile boolean running = true;
    private volatile Connection connection;

    public MirrorUpdateListener(String brokerUrl, String queueName, MirrorSynchronizer synchronizer) {
        this.brokerUrl = brokerUrl;
        this.queueName = queueName;
        this.synchronizer = synchronizer;
    }

    /**
     * Starts the listener in a background daemon thread.
     */
    public void start() {
        Thread listenerThread = new Thread(this);
        listenerThread.setDaemon(true);
        listenerThread.setName("Mirror-Update-Listener");
        listenerThread.start();
    }

    /**
     * Stops the loop; closing the connection interrupts a blocking receive.
     */
    public void stop() {
        this.running = false;
        Connection current = connection;
        if (current != null) {
            try {
                current.close();
            } catch (JMSException e) {
                logger.warn("Exception while closing connection during shutdown.", e);
            }
        }
    }

    @Override
    public void run() {
        ConnectionFactory connectionFactory = new ActiveMQConnectionFactory(brokerUrl);

        while (running) {
            try {
                connection = connectionFactory.createConnection();
                connection.start();
                Session session = connection.createSession(false, Session.AUTO_ACKNOWLEDGE);
                Destination destination = session.createQueue(queueName);
                MessageConsumer consumer = session.createConsumer(destination);

                logger.info("Listener connected. Waiting for mirror updates from queue '{}'...", queueName);

                while (running) {
                    Message message = consumer.receive(RECEIVE_TIMEOUT_MS);
                    if (message instanceof TextMessage textMessage) {
                        processMessage(textMessage.getText());
                    }
                }
            } catch (JMSException e) {
                if (running) {
                    logger.error("JMS connection failed: {}. Retrying in {} ms...", e.getMessage(), RECONNECT_DELAY_MS);
                    sleep(RECONNECT_DELAY_MS);
                }
            } finally {
                closeQuietly();
            }
        }
        logger.info("Mirror update listener has shut down.");
    }

    void processMessage(String messageText) {
        try {
            MirrorUpdate update = MirrorUpdate.fromJson(messageText);
            logger.debug("Received mirror {} for record {}", update.type(), update.recordId());
            update.applyTo(synchronizer);
        } catch (JsonParseException | IllegalArgumentException e) {
            logger.error("Discarding malformed mirror update message: '{}'", messageText, e);
        } catch (RuntimeException e) {
            logger.error("Failed to apply mirror update message '{}'", messageText, e);
        }
    }

    private void closeQuietly() {
        Connection current = connection;
        if (current == null) {
            return;
        }
        try {
            current.close();
        } catch (JMSException e) {
            logger.debug("Error closing JMS connection: {}", e.getMessage());
        }
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }
}
