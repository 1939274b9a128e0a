package org.permsync.main;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class Monitoring {
    private static Logger logger = LoggerFactory.getLogger(Monitoring.class);

    private static String exceptionLogPath = "logs/last_exception.log";

    static synchronized void setExceptionLogPath(String path) {
        exceptionLogPath = path;
    }

    // Dump an exception to a file so we can monitor it through health checks/Nagios/whatever.
    public static synchronized void recordException(Throwable e) {
        File target = new File(exceptionLogPath);

        if (target.getParentFile() != null) {
            target.getParentFile().mkdirs();
        }

        try (Writer log = new FileWriter(target)) {
            log.write(String.valueOf(e.getMessage()));
            log.write("\n");

            for (StackTraceElement frame : e.getStackTrace()) {
                log.write(frame.toString());
                log.write("\n");
            }
        } catch (IOException e2) {
            logger.warn("Couldn't record exception to {}: {}", exceptionLogPath, e2.getMessage());
        }
    }

}
