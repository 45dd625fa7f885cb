package com.goormthonuniv.groundedchat.exception;

/**
 * 턴/프로필 저장소 읽기·쓰기 실패. 해당 턴을 실패시킨다 (조용히 버리지 않음).
 */
public class PersistenceException extends RuntimeException {
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
