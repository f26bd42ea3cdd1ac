package org.nowstart.perpbot.data.exception;

import org.springframework.boot.ExitCodeGenerator;

public class StartupPreconditionException extends RuntimeException implements ExitCodeGenerator {

    public StartupPreconditionException(String message) {
        super(message);
    }

    @Override
    public int getExitCode() {
        return 1;
    }
}
