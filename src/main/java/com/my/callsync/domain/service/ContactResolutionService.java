package com.my.callsync.domain.service;

import com.my.callsync.domain.exception.InvalidRequestException;
import com.my.callsync.domain.model.CallStatus;
import com.my.callsync.domain.model.ConfirmResult;
import com.my.callsync.domain.model.ConfirmedAttendee;
import com.my.callsync.domain.model.Contact;
import com.my.callsync.domain.model.ContactResolutionQueue;
import com.my.callsync.domain.model.ContactStage;
import com.my.callsync.domain.model.LocalCallRecord;
import com.my.callsync.domain.model.NewContact;
import com.my.callsync.domain.model.PendingAttendee;
import com.my.callsync.domain.port.in.ConfirmPendingContactsUseCase;
import com.my.callsync.domain.port.out.CallRecordStorePort;
import com.my.callsync.domain.port.out.ContactDirectoryPort;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 왜: 사용자가 승인한 보류 참석자를 연락처와 통화 기록으로 만들어, 다음 동기화 패스가 해당 이벤트를 이미 미러링된 것으로 인식하게 하기 위함.
 * <p>
 * 항목마다 독립적으로 처리한다. 한 항목의 실패는 배치를 중단시키지 않고 큐에 남아 다음 재시도를 기다린다.
 */
public class ContactResolutionService implements ConfirmPendingContactsUseCase {

    private static final Logger log = Logger.getLogger(ContactResolutionService.class);

    private final ContactDirectoryPort contactDirectory;
    private final CallRecordStorePort callRecordStore;
    private final Supplier<String> idGenerator;

    public ContactResolutionService(ContactDirectoryPort contactDirectory, CallRecordStorePort callRecordStore) {
        this(contactDirectory, callRecordStore, () -> UUID.randomUUID().toString());
    }

    ContactResolutionService(ContactDirectoryPort contactDirectory,
                             CallRecordStorePort callRecordStore,
                             Supplier<String> idGenerator) {
        this.contactDirectory = contactDirectory;
        this.callRecordStore = callRecordStore;
        this.idGenerator = idGenerator;
    }

    @Override
    public ConfirmResult confirm(String userId, List<ConfirmedAttendee> approved) {
        if (approved == null || approved.isEmpty()) {
            throw new InvalidRequestException("확인할 연락처가 없습니다.");
        }
        ContactResolutionQueue queue = new ContactResolutionQueue(
                approved.stream().map(ConfirmedAttendee::pending).toList());
        int created = confirm(userId, queue, approved);
        return new ConfirmResult(created, queue.pending());
    }

    /**
     * 성공한 항목은 큐에서 제거하고 실패한 항목은 남긴다.
     *
     * @return 새 통화 기록을 만든 항목 수. 외부 이벤트가 이미 미러링되어 있던 항목은 해결되지만 세지 않는다.
     */
    public int confirm(String userId, ContactResolutionQueue queue, List<ConfirmedAttendee> approved) {
        int created = 0;
        for (ConfirmedAttendee entry : approved) {
            try {
                if (materialize(userId, entry)) {
                    created++;
                }
                queue.resolve(entry.email());
            } catch (RuntimeException e) {
                log.warnf("보류 참석자 확정 실패, 큐에 남깁니다: email=%s, eventId=%s, cause=%s",
                        entry.email(), entry.pending().externalEventId(), e.getMessage());
            }
        }
        log.infof("보류 참석자 확정 완료: userId=%s, created=%d, remaining=%d", userId, created, queue.size());
        return created;
    }

    private boolean materialize(String userId, ConfirmedAttendee entry) {
        PendingAttendee pending = entry.pending();
        // 이전 시도에서 연락처만 만들어진 경우 재사용한다
        Optional<Contact> existing = contactDirectory.findByEmail(userId, pending.email());
        Contact contact = existing.orElseGet(() -> contactDirectory.create(userId, new NewContact(
                entry.name(),
                pending.email(),
                entry.firm(),
                entry.position(),
                entry.connectionType(),
                ContactStage.SCHEDULED
        )));
        LocalCallRecord record = new LocalCallRecord(
                idGenerator.get(),
                userId,
                contact.id(),
                pending.eventTitle(),
                pending.timeRange(),
                pending.location(),
                pending.notes(),
                CallStatus.SCHEDULED,
                SyncEngine.PROVIDER,
                pending.externalEventId()
        );
        boolean inserted = callRecordStore.insertIfAbsent(record);
        if (existing.isPresent()) {
            contactDirectory.advanceStage(userId, contact.id(), ContactStage.SCHEDULED);
        }
        if (!inserted) {
            log.infof("이미 미러링된 외부 이벤트라 연락처만 연결했습니다: eventId=%s", pending.externalEventId());
        }
        return inserted;
    }
}
