package com.apifarm.web.service;

import com.apifarm.common.dto.LoginResponse;
import com.apifarm.common.exception.DuplicateUserException;
import com.apifarm.common.exception.InvalidCredentialsException;
import com.apifarm.common.exception.PersistenceException;
import com.apifarm.common.exception.UnauthorizedException;
import com.apifarm.common.util.IdGenerator;
import com.apifarm.web.config.SessionProperties;
import com.apifarm.web.entity.SessionEntity;
import com.apifarm.web.entity.UserEntity;
import com.apifarm.web.repository.SessionRepository;
import com.apifarm.web.repository.UserRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mindrot.jbcrypt.BCrypt;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 用户注册、登录与会话令牌管理。
 * <p>
 * 用户和会话在启动时全量加载到内存，读操作只查内存；
 * 写操作先同步写入 SQLite，成功后再更新内存，写盘失败则本次变更不生效。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionStore {

    /** 32 字节 = 256 位熵 */
    private static final int TOKEN_BYTES = 32;

    private final UserRepository userRepository;
    private final SessionRepository sessionRepository;
    private final SessionProperties properties;
    private final Clock clock;

    private final Map<String, UserEntity> usersByName = new ConcurrentHashMap<>();
    private final Map<String, SessionEntity> sessionsByToken = new ConcurrentHashMap<>();
    private final Object userMonitor = new Object();
    private final Object sessionMonitor = new Object();

    /** 用户名不存在时也执行一次哈希比对，两种失败耗时一致 */
    private String dummyHash;

    @PostConstruct
    public void load() {
        try {
            userRepository.findAll().forEach(user -> usersByName.put(user.getUsername(), user));
            sessionRepository.findAll().forEach(session -> sessionsByToken.put(session.getToken(), session));
        } catch (DataAccessException e) {
            throw new PersistenceException("加载用户与会话数据失败", e);
        }
        dummyHash = BCrypt.hashpw(IdGenerator.secureToken(16), BCrypt.gensalt(properties.getBcryptRounds()));
        log.info("已加载 {} 个用户, {} 条会话记录", usersByName.size(), sessionsByToken.size());
    }

    /**
     * 注册新用户。
     *
     * @return 用户 ID
     * @throws DuplicateUserException 用户名已存在
     */
    public Long register(String username, String password) {
        String passwordHash = BCrypt.hashpw(digest(password), BCrypt.gensalt(properties.getBcryptRounds()));

        synchronized (userMonitor) {
            if (usersByName.containsKey(username)) {
                throw new DuplicateUserException("用户名已存在: " + username);
            }
            UserEntity user = UserEntity.builder()
                    .username(username)
                    .passwordHash(passwordHash)
                    .createdAt(clock.millis())
                    .build();
            UserEntity saved = write("保存用户", () -> userRepository.save(user));
            usersByName.put(username, saved);
            log.info("新用户注册: {} (id={})", username, saved.getId());
            return saved.getId();
        }
    }

    /**
     * 校验密码并签发新的会话令牌。同一用户可同时持有多个有效令牌。
     *
     * @throws InvalidCredentialsException 用户名不存在或密码错误
     */
    public LoginResponse login(String username, String password) {
        UserEntity user = usersByName.get(username);
        boolean matches = BCrypt.checkpw(digest(password), user != null ? user.getPasswordHash() : dummyHash);
        if (user == null || !matches) {
            log.info("登录失败: {}", username);
            throw new InvalidCredentialsException("用户名或密码错误");
        }

        synchronized (sessionMonitor) {
            String token;
            do {
                token = IdGenerator.secureToken(TOKEN_BYTES);
            } while (sessionsByToken.containsKey(token));

            SessionEntity session = SessionEntity.builder()
                    .token(token)
                    .userId(user.getId())
                    .issuedAt(clock.millis())
                    .build();
            SessionEntity saved = write("保存会话", () -> sessionRepository.save(session));
            sessionsByToken.put(token, saved);
            log.info("用户登录: {} (id={})", username, user.getId());
            return new LoginResponse(token, user.getId());
        }
    }

    /**
     * 校验令牌。
     *
     * @return 令牌所属用户 ID
     * @throws UnauthorizedException 令牌不存在、已注销或已过期
     */
    public Long verify(String token) {
        SessionEntity session = token != null ? sessionsByToken.get(token) : null;
        if (session == null || session.getRevokedAt() != null || isExpired(session)) {
            throw new UnauthorizedException("会话无效或已过期，请重新登录");
        }
        return session.getUserId();
    }

    /**
     * 注销令牌，只影响当前令牌。对无效令牌同样抛出 {@link UnauthorizedException}，
     * 调用方无法区分“已注销”和“从未存在”。
     */
    public void logout(String token) {
        synchronized (sessionMonitor) {
            Long userId = verify(token);
            long now = clock.millis();
            int updated = write("注销会话", () -> sessionRepository.revoke(token, now));
            if (updated != 1) {
                log.warn("注销会话时数据库记录数异常: {}", updated);
            }
            sessionsByToken.computeIfPresent(token, (key, session) -> session.toBuilder().revokedAt(now).build());
            log.info("用户注销: id={}", userId);
        }
    }

    private boolean isExpired(SessionEntity session) {
        if (properties.getTtlHours() <= 0) {
            return false;
        }
        long ttlMillis = properties.getTtlHours() * 3_600_000L;
        return clock.millis() - session.getIssuedAt() > ttlMillis;
    }

    /**
     * BCrypt 只取前 72 字节，先做 SHA-256 再 Base64，任意长度的密码都完整参与比对。
     */
    static String digest(String password) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(password.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JVM 不支持 SHA-256", e);
        }
    }

    private <T> T write(String action, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException e) {
            log.error("{}失败", action, e);
            throw new PersistenceException(action + "失败，请稍后重试", e);
        }
    }
}
