package com.prpilot.orchestrator.api;

import com.prpilot.orchestrator.repository.IdGenerator;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;

/**
 * Beans the exception handler needs that a web slice does not pick up on its own.
 */
@TestConfiguration
@Import(IdGenerator.class)
class ApiTestSupport {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
