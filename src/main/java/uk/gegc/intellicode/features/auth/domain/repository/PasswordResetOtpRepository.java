package uk.gegc.intellicode.features.auth.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.intellicode.features.auth.domain.model.PasswordResetOtp;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PasswordResetOtpRepository extends JpaRepository<PasswordResetOtp, UUID> {

    long countByEmailAndCreatedAtAfter(String email, LocalDateTime since);

    Optional<PasswordResetOtp> findFirstByEmailAndCreatedAtAfterOrderByCreatedAtAsc(String email, LocalDateTime since);

    @Query("""
        SELECT o FROM PasswordResetOtp o
        WHERE o.email = :email AND o.otpCode = :code AND o.used = false AND o.expiresAt > :now
        ORDER BY o.createdAt DESC
        """)
    Optional<PasswordResetOtp> findValid(@Param("email") String email,
                                         @Param("code") String code,
                                         @Param("now") LocalDateTime now);

    @Modifying
    @Transactional
    @Query("UPDATE PasswordResetOtp o SET o.used = true WHERE o.userId = :userId AND o.used = false")
    int invalidateUserOtps(@Param("userId") UUID userId);

    @Modifying
    @Transactional
    @Query("""
        UPDATE PasswordResetOtp o
        SET o.used = true
        WHERE o.id = :id AND o.used = false AND o.expiresAt > :now
        """)
    int markUsedIfValid(@Param("id") UUID id, @Param("now") LocalDateTime now);
}
