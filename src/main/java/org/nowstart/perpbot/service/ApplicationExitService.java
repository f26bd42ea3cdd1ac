package org.nowstart.perpbot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Service;

/**
 * Closes the application context and ends the JVM with the given code. Runs on its own thread so the
 * scheduler thread that requested the exit is not blocked by its own shutdown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApplicationExitService {

    private final ConfigurableApplicationContext applicationContext;

    public void exit(int exitCode) {
        Thread exitThread = new Thread(() -> {
            log.info("event=application_exit code={}", exitCode);
            System.exit(SpringApplication.exit(applicationContext, () -> exitCode));
        }, "perpbot-exit");
        exitThread.setDaemon(false);
        exitThread.start();
    }
}
