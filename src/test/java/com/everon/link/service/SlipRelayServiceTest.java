package com.everon.link.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Base64;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.everon.link.config.EveronLinkProperties;
import com.everon.link.model.dto.DeviceEventDTO;
import com.everon.link.service.SlipRelayService.RelayOutcome;
import com.everon.link.support.InMemoryRegistrationStore;
import com.everon.link.support.RecordingTransport;
import com.everon.link.support.TestFixtures;

class SlipRelayServiceTest {

    private RecordingTransport transport;
    private SlipRelayService relay;

    @BeforeEach
    void setUp() {
        InMemoryRegistrationStore store = new InMemoryRegistrationStore();
        store.put(TestFixtures.activeRecord("ABC123"));
        EveronLinkProperties properties = TestFixtures.properties();
        RegistrationBindingService bindingService =
                TestFixtures.bindingService(store, TestFixtures.clockAt("2023-12-31"), properties);
        bindingService.bind("42", "ABC123");

        transport = new RecordingTransport();
        relay = new SlipRelayService(bindingService, transport, new BotMessages(properties));
    }

    @Test
    void testEventSendsConnectivityMessage() {
        var result = relay.relay(DeviceEventDTO.builder().type(DeviceEventDTO.SEND_TEST).chatId("42").build());

        assertEquals(RelayOutcome.DELIVERED, result.outcome());
        assertTrue(transport.sent.get(0).body().contains("Telegram connection is working"));
    }

    @Test
    void slipIsForwardedAsPhotoWithCaption() {
        String image = Base64.getEncoder().encodeToString(new byte[] {1, 2, 3, 4});
        DeviceEventDTO event = DeviceEventDTO.builder()
                .type(DeviceEventDTO.SEND_SLIP)
                .chatId("42")
                .imageBase64(image)
                .meta(DeviceEventDTO.SlipMeta.builder().bank("KBank").ref("REF1").build())
                .build();

        var result = relay.relay(event);

        assertEquals(RelayOutcome.DELIVERED, result.outcome());
        var sent = transport.ofKind("photo").get(0);
        assertEquals("slip.jpg:4", sent.body());
        assertTrue(sent.caption().contains("🏦 Bank: KBank"));
        assertTrue(sent.caption().contains("💰 Amount: -"));
    }

    @Test
    void unboundChatIsRefused() {
        var result = relay.relay(DeviceEventDTO.builder().type(DeviceEventDTO.SEND_TEST).chatId("99").build());

        assertEquals(RelayOutcome.CHAT_NOT_BOUND, result.outcome());
        assertTrue(transport.sent.isEmpty());
    }

    @Test
    void malformedEventsAreRejected() {
        assertEquals(RelayOutcome.INVALID_REQUEST,
                relay.relay(DeviceEventDTO.builder().type("REBOOT").chatId("42").build()).outcome());
        assertEquals(RelayOutcome.INVALID_REQUEST,
                relay.relay(DeviceEventDTO.builder().type(DeviceEventDTO.SEND_SLIP).chatId("42").build()).outcome());
        assertEquals(RelayOutcome.INVALID_REQUEST,
                relay.relay(DeviceEventDTO.builder().type(DeviceEventDTO.SEND_SLIP).chatId("42")
                        .imageBase64("@@@").build()).outcome());
        assertEquals(RelayOutcome.INVALID_REQUEST,
                relay.relay(DeviceEventDTO.builder().type(DeviceEventDTO.SEND_TEST).build()).outcome());
    }

    @Test
    void transportFailureIsReported() {
        transport.setFailing(true);

        var result = relay.relay(DeviceEventDTO.builder().type(DeviceEventDTO.SEND_TEST).chatId("42").build());

        assertEquals(RelayOutcome.DELIVERY_FAILED, result.outcome());
        assertEquals("502 Bad Gateway", result.message());
    }
}
