package com.redisui.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

/*
[로컬 기동]
JWT_SECRET=... ADMIN_USERNAME=admin ADMIN_PASSWORD='Admin123!' mvn -pl backend spring-boot:run

# 로그인 (쿠키 파일에 저장)
curl -i -X POST "http://localhost:8080/api/auth/login" \
  -H "Content-Type: application/json" \
  -c /tmp/rds_cookie.txt \
  -d '{"username":"admin","password":"Admin123!","remember":false}'

# 내 정보
curl -i "http://localhost:8080/api/auth/me" -b /tmp/rds_cookie.txt

# refresh (기존 쿠키 보내고 새 쿠키로 덮어쓰기)
curl -i -X POST "http://localhost:8080/api/auth/refresh" -b /tmp/rds_cookie.txt -c /tmp/rds_cookie.txt

# 로그아웃
curl -i -X POST "http://localhost:8080/api/auth/logout" -b /tmp/rds_cookie.txt -c /tmp/rds_cookie.txt
*/

/**
 * UserDetailsService 자동설정은 끈다.
 * JWT + 자체 세션 저장소를 쓰므로 기본 인메모리 유저("Using generated security password")가 필요 없다.
 */
@SpringBootApplication(exclude = {UserDetailsServiceAutoConfiguration.class})
public class BackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(BackendApplication.class, args);
    }
}
