package com.qqsuccubus.telemetry.station.mqtt;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MqttTransportTest {

    private static final byte[] CONNACK_ACCEPTED = {0x20, 0x02, 0x00, 0x00};

    private MqttTransport transport;
    private ServerSocket broker;
    private Thread brokerThread;

    @AfterEach
    void tearDown() throws Exception {
        if (transport != null) {
            transport.disconnect();
        }
        if (broker != null) {
            broker.close();
        }
        if (brokerThread != null) {
            brokerThread.join(2000);
        }
    }

    @Test
    void testConnect_RetriesUntilBrokerComesUp() throws Exception {
        int port;
        try (ServerSocket freePort = new ServerSocket(0)) {
            port = freePort.getLocalPort();
        }
        CountDownLatch connected = new CountDownLatch(1);
        transport = new MqttTransport("measurement", "tcp://127.0.0.1:" + port, "station-test", null, null, 0,
            Duration.ofMillis(200), Duration.ofSeconds(1));

        // Nothing listens yet, the first attempt is refused
        transport.connect((topic, payload) -> { }, connected::countDown);
        Thread.sleep(500);
        assertFalse(transport.isConnected());

        broker = new ServerSocket();
        broker.setReuseAddress(true);
        broker.bind(new InetSocketAddress("127.0.0.1", port));
        brokerThread = new Thread(this::acceptOneClient, "fake-broker");
        brokerThread.setDaemon(true);
        brokerThread.start();

        assertTrue(connected.await(10, TimeUnit.SECONDS), "connect callback never fired");
        assertTrue(transport.isConnected());
    }

    @Test
    void testDisconnect_StopsPendingRetries() throws Exception {
        int port;
        try (ServerSocket freePort = new ServerSocket(0)) {
            port = freePort.getLocalPort();
        }
        CountDownLatch connected = new CountDownLatch(1);
        transport = new MqttTransport("supervisor", "tcp://127.0.0.1:" + port, "station-test-2", null, null, 0,
            Duration.ofMillis(100), Duration.ofMillis(200));

        transport.connect((topic, payload) -> { }, connected::countDown);
        Thread.sleep(300);
        transport.disconnect();
        transport = null;

        assertFalse(connected.await(1, TimeUnit.SECONDS));
    }

    private void acceptOneClient() {
        try (Socket socket = broker.accept()) {
            DataInputStream in = new DataInputStream(socket.getInputStream());
            readPacket(in);
            OutputStream out = socket.getOutputStream();
            out.write(CONNACK_ACCEPTED);
            out.flush();
            // Hold the session open until the client sends DISCONNECT or goes away
            while (in.read() >= 0) {
                in.skipBytes(in.available());
            }
        } catch (IOException e) {
            // Broker socket closed by tearDown
        }
    }

    private static void readPacket(DataInputStream in) throws IOException {
        in.readUnsignedByte();
        int remaining = 0;
        int multiplier = 1;
        int digit;
        do {
            digit = in.readUnsignedByte();
            remaining += (digit & 0x7F) * multiplier;
            multiplier *= 128;
        } while ((digit & 0x80) != 0);
        in.readFully(new byte[remaining]);
    }
}
