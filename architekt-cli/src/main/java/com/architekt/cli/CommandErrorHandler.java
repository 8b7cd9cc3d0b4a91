package com.architekt.cli;

import com.architekt.core.error.NotFoundException;
import com.architekt.core.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;
import picocli.CommandLine.IExitCodeExceptionMapper;
import picocli.CommandLine.ParseResult;

import java.io.PrintWriter;

/**
 * Prints engine errors to stderr and maps them to {@link ExitCodes}.
 *
 * <p>Validation errors print one line per message. Unexpected failures are logged with their
 * stack trace.
 */
public class CommandErrorHandler implements IExecutionExceptionHandler, IExitCodeExceptionMapper {

    private static final Logger log = LoggerFactory.getLogger(CommandErrorHandler.class);

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult) {
        PrintWriter err = commandLine.getErr();
        if (ex instanceof ValidationException validation) {
            validation.errors().forEach(error -> err.println("✗ " + error));
        } else if (ex instanceof NotFoundException) {
            err.println("✗ " + ex.getMessage());
        } else {
            log.error("Command {} failed", commandLine.getCommandName(), ex);
            err.println("✗ Command failed: " + ex.getMessage());
        }
        err.flush();
        return getExitCode(ex);
    }

    @Override
    public int getExitCode(Throwable exception) {
        if (exception instanceof ValidationException) {
            return ExitCodes.VALIDATION;
        }
        if (exception instanceof NotFoundException) {
            return ExitCodes.NOT_FOUND;
        }
        return ExitCodes.FAILURE;
    }
}
