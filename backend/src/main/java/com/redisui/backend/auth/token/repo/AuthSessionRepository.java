package com.redisui.backend.auth.token.repo;

import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.redisui.backend.auth.token.domain.AuthSession;
import com.redisui.backend.auth.token.domain.LiveSession;

public interface AuthSessionRepository extends JpaRepository<AuthSession, Long> {

    // 만료/소유자 상태와 무관한 원본 행 조회 (테스트에서 저장 상태 검증용)
    Optional<AuthSession> findByTokenHash(String tokenHash);

    /**
     * refresh 토큰 hash로 살아있는 세션 조회 (unique 인덱스)
     * - 미만료 + 소유자 활성 조건까지 한 번에 건다
     */
    @Query("""
            select new com.redisui.backend.auth.token.domain.LiveSession(s, u)
              from AuthSession s, User u
             where u.id = s.userId
               and s.tokenHash = :tokenHash
               and s.expiresAt > :now
               and u.active = true
            """)
    Optional<LiveSession> findLiveByTokenHash(@Param("tokenHash") String tokenHash,
                                              @Param("now") LocalDateTime now);

    /**
     * Access Token의 (sid, sub)로 세션 유효성 확인
     * - 존재 / 미만료 / 소유자 일치 / 소유자 활성을 하나의 쿼리로 판단
     */
    @Query("""
            select new com.redisui.backend.auth.token.domain.LiveSession(s, u)
              from AuthSession s, User u
             where u.id = s.userId
               and s.id = :sessionId
               and s.userId = :userId
               and s.expiresAt > :now
               and u.active = true
            """)
    Optional<LiveSession> findLive(@Param("sessionId") Long sessionId,
                                   @Param("userId") Long userId,
                                   @Param("now") LocalDateTime now);

    /**
     * refresh 회전 (compare-and-swap)
     * - 현재 hash가 그대로이고 아직 만료 전일 때만 교체
     * - 반환값 0 = 이미 다른 요청이 회전했거나 로그아웃/만료됨
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update AuthSession s
               set s.tokenHash = :newHash,
                   s.expiresAt = :newExpiresAt,
                   s.lastUsedAt = :now,
                   s.ipAddress = :ipAddress,
                   s.userAgent = :userAgent
             where s.id = :id
               and s.tokenHash = :currentHash
               and s.expiresAt > :now
            """)
    int rotate(@Param("id") Long id,
               @Param("currentHash") String currentHash,
               @Param("newHash") String newHash,
               @Param("newExpiresAt") LocalDateTime newExpiresAt,
               @Param("now") LocalDateTime now,
               @Param("ipAddress") String ipAddress,
               @Param("userAgent") String userAgent);

    @Modifying(clearAutomatically = true)
    @Query("delete from AuthSession s where s.id = :id")
    int deleteSession(@Param("id") Long id);

    @Modifying
    @Query("delete from AuthSession s where s.expiresAt <= :now")
    int deleteExpired(@Param("now") LocalDateTime now);
}
