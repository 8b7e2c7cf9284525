package com.sentidash.backend.modules.magiclink;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentidash.backend.modules.auth.domain.AppUser;
import com.sentidash.backend.modules.auth.domain.UserRole;
import com.sentidash.backend.modules.auth.domain.VerificationStatus;
import com.sentidash.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.sentidash.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.sentidash.backend.modules.magiclink.application.MagicLinkMailer;
import com.sentidash.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.web.util.UriComponentsBuilder;

@SpringBootTest
@AutoConfigureMockMvc
class MagicLinkIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AppUserRepository appUserRepository;

    @Autowired
    private UserSessionRepository userSessionRepository;

    @MockBean
    private MagicLinkMailer mailer;

    @Test
    @DisplayName("매직 링크는 한 번만 로그인시키고 계정을 FREE/VERIFIED 로 만든다")
    void magicLinkSignsInOnce() throws Exception {
        String token = requestLink("first@example.com", null);

        MvcResult verified = mockMvc.perform(get("/auth/verify").param("token", token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authType").value("AUTHENTICATED"))
                .andExpect(jsonPath("$.role").value("FREE"))
                .andReturn();

        UUID userId = UUID.fromString(body(verified).path("userId").asText());
        AppUser user = appUserRepository.findById(userId).orElseThrow();
        assertThat(user.getPrimaryEmail()).isEqualTo("first@example.com");
        assertThat(user.getVerification()).isEqualTo(VerificationStatus.VERIFIED);
        assertThat(user.getRoleAssignedBy()).isEqualTo("magic-link");

        mockMvc.perform(get("/auth/verify").param("token", token))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("MAGIC_LINK_ALREADY_USED"));
    }

    @Test
    @DisplayName("같은 링크를 동시에 열면 세션은 하나만 발급되고 나머지는 409 를 받는다")
    void concurrentVerificationIssuesSingleSession() throws Exception {
        String token = requestLink("race@example.com", null);

        int threads = 8;
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<Future<MvcResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    ready.countDown();
                    start.await();
                    return mockMvc.perform(get("/auth/verify").param("token", token)).andReturn();
                }));
            }
            assertThat(ready.await(10, TimeUnit.SECONDS)).isTrue();
            start.countDown();

            int succeeded = 0;
            for (Future<MvcResult> future : futures) {
                MvcResult result = future.get(30, TimeUnit.SECONDS);
                if (result.getResponse().getStatus() == 200) {
                    succeeded++;
                } else {
                    assertThat(result.getResponse().getStatus()).isEqualTo(409);
                    assertThat(body(result).path("code").asText()).isEqualTo("MAGIC_LINK_ALREADY_USED");
                }
            }
            assertThat(succeeded).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }

        AppUser user = appUserRepository.findByPrimaryEmailIgnoreCase("race@example.com").orElseThrow();
        assertThat(userSessionRepository.findActiveSessions(user.getId(), OffsetDateTime.now())).hasSize(1);
        assertThat(userSessionRepository.count()).isEqualTo(1);
    }

    @Test
    void unknownTokenIsBadRequest() throws Exception {
        mockMvc.perform(get("/auth/verify").param("token", "does-not-exist"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MAGIC_LINK_INVALID"));
    }

    @Test
    @DisplayName("익명 세션에서 요청한 링크는 같은 사용자 id 를 승급시킨다")
    void anonymousRequesterKeepsUserId() throws Exception {
        MvcResult bootstrap = mockMvc.perform(post("/auth/anonymous"))
                .andExpect(status().isCreated())
                .andReturn();
        JsonNode anonymous = body(bootstrap);
        UUID anonymousId = UUID.fromString(anonymous.path("userId").asText());

        String token = requestLink("upgrade@example.com", anonymous.path("accessToken").asText());
        assertThat(appUserRepository.findById(anonymousId).orElseThrow().getVerification())
                .isEqualTo(VerificationStatus.PENDING);

        mockMvc.perform(get("/auth/verify").param("token", token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value(anonymousId.toString()))
                .andExpect(jsonPath("$.role").value(UserRole.FREE.name()));
    }

    @Test
    void invalidEmailIsValidationError() throws Exception {
        mockMvc.perform(post("/auth/magic-link")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"not-an-email\"}"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void sixthRequestWithinAnHourIsRateLimited() throws Exception {
        for (int i = 0; i < 5; i++) {
            requestLink("busy@example.com", null);
        }

        mockMvc.perform(post("/auth/magic-link")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"busy@example.com\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.code").value("RATE_LIMITED"));
    }

    private String requestLink(String email, String bearer) throws Exception {
        var request = post("/auth/magic-link")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\":\"" + email + "\"}");
        if (bearer != null) {
            request.header("Authorization", "Bearer " + bearer);
        }
        mockMvc.perform(request)
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("SENT"));

        ArgumentCaptor<String> link = ArgumentCaptor.forClass(String.class);
        verify(mailer, atLeastOnce()).send(eq(email), link.capture(), any());
        return UriComponentsBuilder.fromUriString(link.getValue()).build().getQueryParams().getFirst("token");
    }

    private JsonNode body(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
