package com.everon.link.controller.api;

import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.everon.link.service.RecordMatcher;
import com.everon.link.store.RegistrationStore;
import com.everon.link.transport.MessagingTransport;
import com.everon.link.transport.MessagingTransport.DeliveryResult;

@SpringBootTest
@AutoConfigureMockMvc
class RegistrationApiTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RegistrationStore store;

    @MockBean
    private MessagingTransport transport;

    @BeforeEach
    void setUp() {
        when(transport.sendText(anyString(), anyString(), any())).thenReturn(DeliveryResult.ok());
        when(transport.sendPhotoUrl(anyString(), anyString(), anyString())).thenReturn(DeliveryResult.ok());
    }

    @Test
    void provisionedCodeCanBeClaimedFromTelegramAndVerified() throws Exception {
        String hash = RecordMatcher.digest("API001", "S");

        mockMvc.perform(post("/api/v1/registrations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\"api001\",\"label\":\"Shop 7\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.codeHash", is(hash)))
                .andExpect(jsonPath("$.status", is("ACTIVE")));

        mockMvc.perform(post("/api/v1/telegram/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"update_id\":1,\"message\":{\"message_id\":5,\"chat\":{\"id\":42},\"text\":\"API001\"}}"))
                .andExpect(status().isOk());

        assertEquals("42", store.findByCodeHash(hash).orElseThrow().getBoundChannelId());

        ArgumentCaptor<String> qrUrl = ArgumentCaptor.forClass(String.class);
        verify(transport).sendPhotoUrl(eq("42"), qrUrl.capture(), anyString());
        String deepLink = URLDecoder.decode(qrUrl.getValue().substring(qrUrl.getValue().indexOf("&data=") + 6),
                StandardCharsets.UTF_8);
        String payload = URLDecoder.decode(deepLink.substring(deepLink.indexOf("payload=") + 8), StandardCharsets.UTF_8);

        mockMvc.perform(post("/api/v1/link/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payload\":\"" + payload + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid", is(true)))
                .andExpect(jsonPath("$.chatId", is("42")));
    }

    @Test
    void operatorCanReleaseBinding() throws Exception {
        String hash = RecordMatcher.digest("API002", "S");
        mockMvc.perform(post("/api/v1/registrations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\"API002\"}"))
                .andExpect(status().isCreated());

        mockMvc.perform(delete("/api/v1/registrations/" + hash + "/binding"))
                .andExpect(status().isConflict());

        mockMvc.perform(post("/api/v1/telegram/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"update_id\":2,\"message\":{\"message_id\":6,\"chat\":{\"id\":77},\"text\":\"api002\"}}"))
                .andExpect(status().isOk());

        mockMvc.perform(delete("/api/v1/registrations/" + hash + "/binding"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.codeHash", is(hash)));

        assertNull(store.findByCodeHash(hash).orElseThrow().getBoundChannelId());
    }

    @Test
    void rejectsBadProvisioningRequests() throws Exception {
        mockMvc.perform(post("/api/v1/registrations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\"API003\"}"))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/api/v1/registrations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\"api003\"}"))
                .andExpect(status().isConflict());

        mockMvc.perform(post("/api/v1/registrations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\"no!\"}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/v1/registrations/" + "0".repeat(64)))
                .andExpect(status().isNotFound());
    }

    @Test
    void deviceEventForUnlinkedChatIsNotFound() throws Exception {
        mockMvc.perform(post("/api/v1/device/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"SEND_TEST\",\"chat_id\":\"555\"}"))
                .andExpect(status().isNotFound());
    }
}
