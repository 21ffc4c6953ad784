package com.qqsuccubus.telemetry.station.mqtt;

import com.qqsuccubus.telemetry.core.error.SubscriptionException;
import org.eclipse.paho.client.mqttv3.IMqttActionListener;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.IMqttToken;
import org.eclipse.paho.client.mqttv3.MqttAsyncClient;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Eclipse Paho implementation of {@link ITelemetryTransport}.
 * <p>
 * Uses the asynchronous client so subscribe/unsubscribe never block the caller. Paho's automatic
 * reconnect only covers connections that were established once, so the first connect is retried
 * here with jittered exponential backoff until it succeeds or {@link #disconnect()} is called.
 * {@code onConnected} runs after every successful connect so callers can restore their
 * subscriptions (clean sessions are used, the broker forgets them on disconnect).
 * </p>
 */
public class MqttTransport implements ITelemetryTransport, MqttCallbackExtended {
    private static final Logger log = LoggerFactory.getLogger(MqttTransport.class);

    private static final int CONNECTION_TIMEOUT_SEC = 10;
    private static final int KEEP_ALIVE_SEC = 60;
    private static final Duration DEFAULT_MIN_BACKOFF = Duration.ofSeconds(1);
    private static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(30);

    private final String name;
    private final String brokerUrl;
    private final String clientId;
    private final String username;
    private final String password;
    private final int qos;
    private final Duration minBackoff;
    private final Duration maxBackoff;

    private volatile MqttAsyncClient client;
    private volatile MessageListener listener;
    private volatile Runnable onConnected;
    private volatile Disposable initialConnect;

    public MqttTransport(String name, String brokerUrl, String clientId, String username, String password, int qos) {
        this(name, brokerUrl, clientId, username, password, qos, DEFAULT_MIN_BACKOFF, DEFAULT_MAX_BACKOFF);
    }

    MqttTransport(String name,
                  String brokerUrl,
                  String clientId,
                  String username,
                  String password,
                  int qos,
                  Duration minBackoff,
                  Duration maxBackoff) {
        this.name = name;
        this.brokerUrl = brokerUrl;
        this.clientId = clientId;
        this.username = username;
        this.password = password;
        this.qos = qos;
        this.minBackoff = minBackoff;
        this.maxBackoff = maxBackoff;
    }

    @Override
    public void connect(MessageListener listener, Runnable onConnected) {
        this.listener = listener;
        this.onConnected = onConnected;
        try {
            client = new MqttAsyncClient(brokerUrl, clientId, new MemoryPersistence());
            client.setCallback(this);

            MqttConnectOptions options = new MqttConnectOptions();
            options.setAutomaticReconnect(true);
            options.setCleanSession(true);
            options.setConnectionTimeout(CONNECTION_TIMEOUT_SEC);
            options.setKeepAliveInterval(KEEP_ALIVE_SEC);
            if (username != null && !username.isEmpty()) {
                options.setUserName(username);
                options.setPassword(password != null ? password.toCharArray() : new char[0]);
            }

            log.info("[{}] Connecting to MQTT broker {} as {}", name, brokerUrl, clientId);
            MqttAsyncClient created = client;
            initialConnect = attemptConnect(created, options)
                .retryWhen(Retry.backoff(Long.MAX_VALUE, minBackoff)
                    .maxBackoff(maxBackoff)
                    .doBeforeRetry(signal -> log.warn("[{}] Connect attempt {} to {} failed, retrying: {}",
                        name, signal.totalRetries() + 1, brokerUrl, signal.failure().toString())))
                .subscribe(
                    ignored -> log.debug("[{}] Connect token completed", name),
                    err -> log.error("[{}] Giving up connecting to {}", name, brokerUrl, err)
                );
        } catch (MqttException e) {
            throw new IllegalStateException("[" + name + "] Cannot create MQTT client for " + brokerUrl, e);
        }
    }

    /**
     * One connect attempt; completes when the broker accepts, errors on any failure.
     */
    private Mono<Boolean> attemptConnect(MqttAsyncClient target, MqttConnectOptions options) {
        return Mono.create(sink -> {
            try {
                target.connect(options, null, new IMqttActionListener() {
                    @Override
                    public void onSuccess(IMqttToken token) {
                        sink.success(Boolean.TRUE);
                    }

                    @Override
                    public void onFailure(IMqttToken token, Throwable cause) {
                        sink.error(cause != null ? cause : new MqttException(MqttException.REASON_CODE_CLIENT_EXCEPTION));
                    }
                });
            } catch (MqttException e) {
                sink.error(e);
            }
        });
    }

    @Override
    public void subscribe(String topic) {
        MqttAsyncClient current = requireClient(topic);
        try {
            current.subscribe(topic, qos, null, loggingListener("subscribe", topic));
        } catch (MqttException e) {
            throw new SubscriptionException(topic, "[" + name + "] subscribe refused for " + topic, e);
        }
    }

    @Override
    public void unsubscribe(String topic) {
        MqttAsyncClient current = requireClient(topic);
        try {
            current.unsubscribe(topic, null, loggingListener("unsubscribe", topic));
        } catch (MqttException e) {
            throw new SubscriptionException(topic, "[" + name + "] unsubscribe refused for " + topic, e);
        }
    }

    @Override
    public boolean isConnected() {
        MqttAsyncClient current = client;
        return current != null && current.isConnected();
    }

    @Override
    public void disconnect() {
        Disposable pending = initialConnect;
        if (pending != null) {
            pending.dispose();
        }
        MqttAsyncClient current = client;
        if (current == null) {
            return;
        }
        try {
            if (current.isConnected()) {
                current.disconnect().waitForCompletion(CONNECTION_TIMEOUT_SEC * 1000L);
            }
            current.close();
            log.info("[{}] Disconnected from {}", name, brokerUrl);
        } catch (MqttException e) {
            log.warn("[{}] Error while disconnecting from {}", name, brokerUrl, e);
        }
    }

    @Override
    public void connectComplete(boolean reconnect, String serverURI) {
        log.info("[{}] {} to {}", name, reconnect ? "Reconnected" : "Connected", serverURI);
        Runnable callback = onConnected;
        if (callback != null) {
            callback.run();
        }
    }

    @Override
    public void connectionLost(Throwable cause) {
        log.warn("[{}] Connection to {} lost, automatic reconnect pending", name, brokerUrl, cause);
    }

    @Override
    public void messageArrived(String topic, MqttMessage message) {
        MessageListener current = listener;
        if (current == null) {
            return;
        }
        // An exception escaping this callback makes Paho drop the connection
        try {
            current.onMessage(topic, message.getPayload());
        } catch (RuntimeException e) {
            log.error("[{}] Message handler failed for topic {}", name, topic, e);
        }
    }

    @Override
    public void deliveryComplete(IMqttDeliveryToken token) {
        // Not used for subscriber
    }

    private MqttAsyncClient requireClient(String topic) {
        MqttAsyncClient current = client;
        if (current == null) {
            throw new SubscriptionException(topic, "[" + name + "] transport not connected", null);
        }
        return current;
    }

    private IMqttActionListener loggingListener(String operation, String topic) {
        return new IMqttActionListener() {
            @Override
            public void onSuccess(IMqttToken token) {
                log.debug("[{}] {} {} acknowledged", name, operation, topic);
            }

            @Override
            public void onFailure(IMqttToken token, Throwable cause) {
                log.warn("[{}] {} {} failed at the broker", name, operation, topic, cause);
            }
        };
    }
}
