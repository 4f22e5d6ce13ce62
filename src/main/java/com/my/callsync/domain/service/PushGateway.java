package com.my.callsync.domain.service;

import com.my.callsync.domain.exception.InvalidRequestException;
import com.my.callsync.domain.model.Contact;
import com.my.callsync.domain.model.EventDraft;
import com.my.callsync.domain.model.LocalCallRecord;
import com.my.callsync.domain.model.OAuthCredential;
import com.my.callsync.domain.model.PushAction;
import com.my.callsync.domain.model.PushRequest;
import com.my.callsync.domain.model.PushResult;
import com.my.callsync.domain.port.in.PushCallRecordUseCase;
import com.my.callsync.domain.port.out.CallRecordStorePort;
import com.my.callsync.domain.port.out.ContactDirectoryPort;
import com.my.callsync.domain.port.out.UserLeasePort;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 왜: 통화 기록의 생성/수정/삭제를 외부 캘린더로 전파하고 외부 이벤트 ID를 기록에 되새겨, 어떤 동작이든 재시도해도 결과가 같도록 하기 위함.
 * <p>
 * create는 외부 ID가 있으면 update로, update는 외부 ID가 없으면 create로 전환한다.
 * delete는 외부 ID가 없으면 아무것도 하지 않으며, 삭제 후 외부 참조는 항상 지운다.
 * 같은 기록에 대한 반영은 {@code push:<user>:<recordId>} 리스 안에서 기록을 다시 읽은 뒤 수행한다.
 */
public class PushGateway implements PushCallRecordUseCase {

    private static final Logger log = Logger.getLogger(PushGateway.class);

    private final TokenVault tokenVault;
    private final CalendarClient calendarClient;
    private final CallRecordStorePort callRecordStore;
    private final ContactDirectoryPort contactDirectory;
    private final UserLeasePort leasePort;

    public PushGateway(TokenVault tokenVault,
                       CalendarClient calendarClient,
                       CallRecordStorePort callRecordStore,
                       ContactDirectoryPort contactDirectory,
                       UserLeasePort leasePort) {
        this.tokenVault = tokenVault;
        this.calendarClient = calendarClient;
        this.callRecordStore = callRecordStore;
        this.contactDirectory = contactDirectory;
        this.leasePort = leasePort;
    }

    @Override
    public PushResult apply(PushRequest request) {
        try (UserLeasePort.Lease ignored = leasePort.acquire(pushLeaseKey(request.userId(), request.callRecordId()))) {
            // 앞선 반영이 남긴 외부 ID를 보도록 리스 안에서 읽는다
            LocalCallRecord record = callRecordStore.findById(request.userId(), request.callRecordId())
                    .orElseThrow(() -> new InvalidRequestException("통화 기록을 찾을 수 없습니다: " + request.callRecordId()));
            OAuthCredential credential = tokenVault.get(request.userId());

            return switch (request.action()) {
                case CREATE, UPDATE -> record.hasExternalEvent()
                        ? update(credential, record, request)
                        : create(credential, record, request);
                case DELETE -> delete(credential, record);
            };
        }
    }

    static String pushLeaseKey(String userId, String callRecordId) {
        return "push:" + userId + ":" + callRecordId;
    }

    private PushResult create(OAuthCredential credential, LocalCallRecord record, PushRequest request) {
        EventDraft draft = buildDraft(record, request.attendeeEmail());
        String externalId = calendarClient.createEvent(credential, credential.calendarId(), draft, request.notifyAttendees());
        callRecordStore.updateExternalEvent(record.userId(), record.id(), SyncEngine.PROVIDER, externalId);
        log.infof("외부 이벤트를 생성했습니다: recordId=%s, eventId=%s", record.id(), externalId);
        return new PushResult(PushAction.CREATE, externalId);
    }

    private PushResult update(OAuthCredential credential, LocalCallRecord record, PushRequest request) {
        EventDraft draft = buildDraft(record, request.attendeeEmail());
        String externalId = calendarClient.updateEvent(credential, credential.calendarId(), draft,
                record.externalEventId(), request.notifyAttendees());
        log.infof("외부 이벤트를 수정했습니다: recordId=%s, eventId=%s", record.id(), externalId);
        return new PushResult(PushAction.UPDATE, record.externalEventId());
    }

    private PushResult delete(OAuthCredential credential, LocalCallRecord record) {
        if (!record.hasExternalEvent()) {
            return new PushResult(PushAction.DELETE, null);
        }
        calendarClient.deleteEvent(credential, credential.calendarId(), record.externalEventId());
        callRecordStore.updateExternalEvent(record.userId(), record.id(), null, null);
        log.infof("외부 이벤트 참조를 정리했습니다: recordId=%s", record.id());
        return new PushResult(PushAction.DELETE, null);
    }

    EventDraft buildDraft(LocalCallRecord record, String attendeeEmail) {
        List<String> parts = new ArrayList<>();
        if (record.notes() != null && !record.notes().isBlank()) {
            parts.add(record.notes());
        }
        contact(record).map(Contact::identityLine).ifPresent(parts::add);
        return new EventDraft(
                record.title(),
                String.join("\n\n", parts),
                record.location(),
                record.timeRange(),
                attendeeEmail
        );
    }

    private Optional<Contact> contact(LocalCallRecord record) {
        if (record.contactId() == null) {
            return Optional.empty();
        }
        return contactDirectory.findById(record.userId(), record.contactId());
    }
}
