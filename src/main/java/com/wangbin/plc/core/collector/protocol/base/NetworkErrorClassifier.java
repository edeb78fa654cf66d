package com.wangbin.plc.core.collector.protocol.base;

import com.wangbin.plc.common.exception.ConfigurationException;
import com.wangbin.plc.common.exception.NetworkException;
import com.wangbin.plc.common.exception.ProtocolDataException;

import java.io.IOException;
import java.net.ConnectException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * 区分网络错误与协议数据错误
 */
public final class NetworkErrorClassifier {

    private static final List<String> NETWORK_KEYWORDS = List.of(
            "timeout", "timed out", "connection", "network", "socket",
            "unreachable", "refused", "reset", "closed");

    private NetworkErrorClassifier() {
    }

    public static boolean isNetworkError(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 10) {
            if (current instanceof NetworkException) {
                return true;
            }
            if (current instanceof ProtocolDataException || current instanceof ConfigurationException) {
                return false;
            }
            if (current instanceof TimeoutException
                    || current instanceof ConnectException
                    || current instanceof IOException) {
                return true;
            }
            if (current.getClass().getSimpleName().contains("Timeout")) {
                return true;
            }
            current = current.getCause();
            depth++;
        }
        return isNetworkMessage(error != null ? error.getMessage() : null);
    }

    public static boolean isNetworkMessage(String message) {
        if (message == null || message.isEmpty()) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String keyword : NETWORK_KEYWORDS) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    public static String describe(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        if (root != error && root.getMessage() != null && !message.contains(root.getMessage())) {
            return message + ": " + root.getMessage();
        }
        return message;
    }
}
