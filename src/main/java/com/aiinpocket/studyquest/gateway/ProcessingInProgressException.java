package com.aiinpocket.studyquest.gateway;

import java.util.UUID;

/**
 * 冪等鍵仍在結算中（可能在其他節點），拒絕重算。
 */
public class ProcessingInProgressException extends RuntimeException {

    public ProcessingInProgressException(UUID userId, UUID sessionId) {
        super("session 正在結算中: user=" + userId + ", session=" + sessionId);
    }
}
