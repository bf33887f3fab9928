package com.quicklook.server;

/**
 * Channel for problems the operator should see. Reporting never blocks or
 * fails the caller.
 */
public interface OperatorNotifier {

    void warn(String message);

    void error(String message);

    void info(String message);
}
