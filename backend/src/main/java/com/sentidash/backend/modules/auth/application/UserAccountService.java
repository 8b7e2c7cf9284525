package com.sentidash.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.sentidash.backend.global.error.ProblemException;
import com.sentidash.backend.modules.auth.domain.AppUser;
import com.sentidash.backend.modules.auth.domain.IdentityProvider;
import com.sentidash.backend.modules.auth.domain.ProviderLink;
import com.sentidash.backend.modules.auth.domain.VerificationStatus;
import com.sentidash.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.sentidash.backend.modules.auth.infrastructure.persistence.ProviderLinkRepository;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 사용자 레코드와 공급자 연결의 1차 쓰기. 각 메서드가 하나의 트랜잭션으로 커밋된다.
 */
@Service
@Transactional
public class UserAccountService {

    private final AppUserRepository appUserRepository;
    private final ProviderLinkRepository providerLinkRepository;
    private final Clock clock;

    public UserAccountService(
            AppUserRepository appUserRepository,
            ProviderLinkRepository providerLinkRepository,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.providerLinkRepository = providerLinkRepository;
        this.clock = clock;
    }

    public AppUser createAnonymousUser() {
        return appUserRepository.save(new AppUser());
    }

    public AppUser createUser(String primaryEmail) {
        AppUser user = new AppUser();
        user.setPrimaryEmail(primaryEmail);
        return appUserRepository.saveAndFlush(user);
    }

    @Transactional(readOnly = true)
    public AppUser requireUser(UUID userId) {
        return appUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));
    }

    @Transactional(readOnly = true)
    public Optional<AppUser> findByEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return appUserRepository.findByPrimaryEmailIgnoreCase(AppUser.normalizeEmail(email));
    }

    @Transactional(readOnly = true)
    public Optional<ProviderLink> findLink(IdentityProvider provider, String subject) {
        return providerLinkRepository.findByProviderAndSubject(provider, subject);
    }

    @Transactional(readOnly = true)
    public List<ProviderLink> findLinks(UUID userId) {
        return providerLinkRepository.findByUserId(userId);
    }

    @Transactional(readOnly = true)
    public boolean hasOAuthProvider(UUID userId) {
        return findLinks(userId).stream().anyMatch(link -> link.getProvider().isOAuth());
    }

    /**
     * 공급자 계정을 사용자에게 연결한다. 같은 subject 가 다른 사용자에게 있으면 거절한다.
     */
    public ProviderLink linkProvider(UUID userId, IdentityProvider provider, String subject, String emailAtProvider) {
        AppUser user = requireUser(userId);
        Optional<ProviderLink> existing = providerLinkRepository.findByProviderAndSubject(provider, subject);
        if (existing.isPresent()) {
            if (!existing.get().getUser().getId().equals(userId)) {
                throw new ProblemException(HttpStatus.CONFLICT, "ACCOUNT_ALREADY_LINKED");
            }
            user.setLastProviderUsed(provider);
            return existing.get();
        }
        if (providerLinkRepository.existsByUserIdAndProvider(userId, provider)) {
            throw new ProblemException(HttpStatus.CONFLICT, "PROVIDER_ALREADY_LINKED");
        }

        ProviderLink link = new ProviderLink();
        link.setUser(user);
        link.setProvider(provider);
        link.setExternalSubjectId(subject);
        link.setEmailAtProvider(AppUser.normalizeEmail(emailAtProvider));
        link.setLinkedAt(OffsetDateTime.now(clock));
        user.setLastProviderUsed(provider);
        try {
            return providerLinkRepository.saveAndFlush(link);
        } catch (DataIntegrityViolationException ex) {
            // (provider, subject) 유일 인덱스에서 동시 연결 경쟁에 진 경우
            throw new ProblemException(HttpStatus.CONFLICT, "ACCOUNT_ALREADY_LINKED", null, ex);
        }
    }

    public void touchLastProvider(UUID userId, IdentityProvider provider) {
        requireUser(userId).setLastProviderUsed(provider);
    }

    /**
     * 주 이메일이 비어 있는 사용자(익명 승격 등)에 이메일을 부여한다.
     */
    public void claimPrimaryEmail(UUID userId, String email) {
        AppUser user = requireUser(userId);
        if (user.getPrimaryEmail() == null && email != null) {
            user.setPrimaryEmail(email);
            appUserRepository.flush();
        }
    }

    public void markPending(UUID userId, String email) {
        AppUser user = requireUser(userId);
        user.setPendingEmail(email);
        user.advanceVerification(VerificationStatus.PENDING, OffsetDateTime.now(clock), "magic-link-request");
    }

    public void markVerified(UUID userId, String email, String markedBy) {
        AppUser user = requireUser(userId);
        user.addVerifiedEmail(email);
        if (email != null && AppUser.normalizeEmail(email).equals(user.getPendingEmail())) {
            user.setPendingEmail(null);
        }
        user.advanceVerification(VerificationStatus.VERIFIED, OffsetDateTime.now(clock), markedBy);
    }
}
