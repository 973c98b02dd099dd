package com.lessonflow.orchestrator.linker;

/**
 * Link 결과
 *
 * found=false: 원래 키/소문자 키 모두 레코드 없음 (예외가 아닌 정상 결과)
 * ownerKeyUsed: 실제로 저장소에 존재하는 키 (found=false면 호출자가 준 키)
 */
public record LinkResult(boolean found, boolean added, String ownerKeyUsed) {

    public static LinkResult notFound(String requestedKey) {
        return new LinkResult(false, false, requestedKey);
    }

    public static LinkResult added(String storedKey) {
        return new LinkResult(true, true, storedKey);
    }

    public static LinkResult alreadyLinked(String storedKey) {
        return new LinkResult(true, false, storedKey);
    }
}
