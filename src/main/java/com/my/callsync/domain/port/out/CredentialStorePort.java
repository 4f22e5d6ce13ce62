package com.my.callsync.domain.port.out;

import com.my.callsync.domain.model.OAuthCredential;

import java.util.Optional;

/**
 * 왜: 사용자별 OAuth 자격 증명의 영속화를 추상화하여 저장소 종류와 무관하게 토큰 수명 주기를 다루기 위함.
 */
public interface CredentialStorePort {

    Optional<OAuthCredential> find(String userId);

    /**
     * 사용자당 한 행으로 upsert 한다.
     */
    void save(OAuthCredential credential);

    /**
     * @return 삭제된 행이 있었으면 true
     */
    boolean delete(String userId);
}
