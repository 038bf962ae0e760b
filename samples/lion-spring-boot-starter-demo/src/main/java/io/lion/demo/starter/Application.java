package io.lion.demo.starter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot Starter demo, zero-config event mapper registration.
 *
 * <p>The starter scans this package (and its sub-packages) for {@code EventMapper} and
 * {@code FlexibleEventMapper} implementations and exposes them through a
 * {@code MapperRegistry} bean. {@link UserRegistrationRunner} maps a sample
 * {@code UserCreatedNotification} on startup and logs the resulting events.
 *
 * <p>Run with: mvn install -DskipTests && mvn -f samples/lion-spring-boot-starter-demo/pom.xml spring-boot:run
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
