package com.my.callsync.domain.port.out;

import com.my.callsync.domain.model.Contact;
import com.my.callsync.domain.model.ContactStage;
import com.my.callsync.domain.model.NewContact;

import java.util.Optional;

/**
 * 왜: 연락처 CRUD는 이 서비스 밖의 협력자이므로 동기화에 필요한 세 가지 계약(조회, 생성, 단계 전진)만 노출하기 위함.
 */
public interface ContactDirectoryPort {

    /**
     * 대소문자를 무시한 정확한 이메일 일치.
     */
    Optional<Contact> findByEmail(String userId, String email);

    Optional<Contact> findById(String userId, String contactId);

    Contact create(String userId, NewContact contact);

    /**
     * 현재 단계가 target보다 앞선 경우에만 target으로 옮긴다. 절대 뒤로 되돌리지 않는다.
     *
     * @return 단계가 실제로 바뀌었으면 true
     */
    boolean advanceStage(String userId, String contactId, ContactStage target);
}
