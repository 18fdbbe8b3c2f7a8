package com.example.musiccatalog.api.command;

import com.example.musiccatalog.common.exception.BusinessException;
import com.example.musiccatalog.common.exception.CopyAbortedException;
import java.io.PrintWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;
import picocli.CommandLine.ParseResult;

/**
 * Turns exceptions escaping a command into operator messages and exit codes. Precondition
 * failures are reported and exit 0; store failures and aborted copies exit 1.
 */
@Component
public class CommandExceptionHandler implements IExecutionExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(CommandExceptionHandler.class);

    public static final int EXIT_FAILURE = 1;

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult) {
        PrintWriter err = commandLine.getErr();
        if (ex instanceof BusinessException) {
            BusinessException be = (BusinessException) ex;
            log.warn("COMMAND_REJECTED command={} code={} message={}", commandLine.getCommandName(), be.getCode(), be.getMessage());
            err.println(be.getMessage());
            if (be.getUserAction() != null) {
                err.println(be.getUserAction());
            }
            err.flush();
            return CommandLine.ExitCode.OK;
        }
        if (ex instanceof CopyAbortedException) {
            CopyAbortedException ce = (CopyAbortedException) ex;
            log.error("COMMAND_FAILED command={} copied={}", commandLine.getCommandName(), ce.getCopiedBeforeAbort(), ex);
            err.println("Copy aborted after " + ce.getCopiedBeforeAbort() + " files: " + ce.getMessage());
            err.flush();
            return EXIT_FAILURE;
        }
        if (ex instanceof DataAccessException) {
            log.error("COMMAND_FAILED command={} reason=store", commandLine.getCommandName(), ex);
            err.println("Catalog store error: " + ((DataAccessException) ex).getMostSpecificCause().getMessage());
            err.flush();
            return EXIT_FAILURE;
        }
        log.error("COMMAND_FAILED command={}", commandLine.getCommandName(), ex);
        err.println("Unexpected error: " + ex.getClass().getSimpleName()
                + (ex.getMessage() == null ? "" : ": " + ex.getMessage()));
        err.flush();
        return EXIT_FAILURE;
    }
}
