package com.my.callsync.domain.service;

import com.my.callsync.domain.exception.InvalidRequestException;
import com.my.callsync.domain.model.CallStatus;
import com.my.callsync.domain.model.Contact;
import com.my.callsync.domain.model.ContactResolutionQueue;
import com.my.callsync.domain.model.ContactStage;
import com.my.callsync.domain.model.ExternalAttendee;
import com.my.callsync.domain.model.ExternalEvent;
import com.my.callsync.domain.model.LocalCallRecord;
import com.my.callsync.domain.model.OAuthCredential;
import com.my.callsync.domain.model.PendingAttendee;
import com.my.callsync.domain.model.SyncRequest;
import com.my.callsync.domain.model.SyncResult;
import com.my.callsync.domain.model.TimeRange;
import com.my.callsync.domain.port.in.SyncCallsUseCase;
import com.my.callsync.domain.port.out.CallRecordStorePort;
import com.my.callsync.domain.port.out.ContactDirectoryPort;
import com.my.callsync.domain.port.out.UserLeasePort;
import org.jboss.logging.Logger;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 왜: 외부 캘린더 이벤트를 통화 기록으로 미러링하되, 외부 이벤트 ID를 멱등 키로 삼아 중복/누락 없이 한 번만 기록하기 위함.
 * <p>
 * 한 패스의 순서는 고정이다: 리스 획득, 미러링된 ID 집합 조회, 이벤트 조회, 이벤트별 건너뛰기 판정, 참석자별 자동 연결 또는 보류.
 * 개별 이벤트나 참석자 처리 실패는 건너뛰기로 처리하고 패스는 항상 끝까지 진행한다.
 */
public class SyncEngine implements SyncCallsUseCase {

    public static final String PROVIDER = "google";

    private static final Logger log = Logger.getLogger(SyncEngine.class);

    private final TokenVault tokenVault;
    private final CalendarClient calendarClient;
    private final CallRecordStorePort callRecordStore;
    private final ContactDirectoryPort contactDirectory;
    private final UserLeasePort leasePort;
    private final Supplier<String> idGenerator;

    public SyncEngine(TokenVault tokenVault,
                      CalendarClient calendarClient,
                      CallRecordStorePort callRecordStore,
                      ContactDirectoryPort contactDirectory,
                      UserLeasePort leasePort) {
        this(tokenVault, calendarClient, callRecordStore, contactDirectory, leasePort, () -> UUID.randomUUID().toString());
    }

    SyncEngine(TokenVault tokenVault,
               CalendarClient calendarClient,
               CallRecordStorePort callRecordStore,
               ContactDirectoryPort contactDirectory,
               UserLeasePort leasePort,
               Supplier<String> idGenerator) {
        this.tokenVault = tokenVault;
        this.calendarClient = calendarClient;
        this.callRecordStore = callRecordStore;
        this.contactDirectory = contactDirectory;
        this.leasePort = leasePort;
        this.idGenerator = idGenerator;
    }

    @Override
    public SyncResult sync(SyncRequest request) {
        TimeRange window = validate(request);
        String userId = request.userId();
        OAuthCredential credential = tokenVault.get(userId);

        try (UserLeasePort.Lease ignored = leasePort.acquire(syncLeaseKey(userId))) {
            Set<String> mirrored = new HashSet<>(callRecordStore.findExternalEventIds(userId, PROVIDER));
            List<ExternalEvent> events = calendarClient.listEvents(credential, credential.calendarId(), window);
            log.infof("동기화 시작: userId=%s, events=%d, alreadyMirrored=%d", userId, events.size(), mirrored.size());

            Pass pass = new Pass(userId, request.ownerEmail(), mirrored);
            for (ExternalEvent event : events) {
                try {
                    pass.process(event);
                } catch (RuntimeException e) {
                    log.warnf("이벤트 처리 실패로 건너뜁니다: eventId=%s, cause=%s", event.id(), e.getMessage());
                    pass.skipped++;
                }
            }
            log.infof("동기화 완료: userId=%s, synced=%d, skipped=%d, pending=%d",
                    userId, pass.synced, pass.skipped, pass.pending.size());
            return new SyncResult(pass.synced, pass.skipped, pass.pending.pending());
        }
    }

    private TimeRange validate(SyncRequest request) {
        if (request == null || request.userId() == null || request.userId().isBlank()) {
            throw new InvalidRequestException("userId가 필요합니다.");
        }
        if (request.timeMin() == null || request.timeMax() == null) {
            throw new InvalidRequestException("timeMin과 timeMax가 필요합니다.");
        }
        if (!request.timeMin().isBefore(request.timeMax())) {
            throw new InvalidRequestException("timeMin은 timeMax보다 앞서야 합니다.");
        }
        return new TimeRange(request.timeMin(), request.timeMax());
    }

    static String syncLeaseKey(String userId) {
        return "sync:" + userId;
    }

    /**
     * 한 패스의 가변 상태. 패스 사이에 공유되지 않는다.
     */
    private final class Pass {

        private final String userId;
        private final String ownerEmail;
        private final Set<String> mirrored;
        private final ContactResolutionQueue pending = new ContactResolutionQueue();
        private int synced;
        private int skipped;

        private Pass(String userId, String ownerEmail, Set<String> mirrored) {
            this.userId = userId;
            this.ownerEmail = ownerEmail;
            this.mirrored = mirrored;
        }

        private void process(ExternalEvent event) {
            if (event.isCancelled()) {
                skipped++;
                return;
            }
            if (mirrored.contains(event.id())) {
                skipped++;
                return;
            }
            List<ExternalAttendee> guests = event.guests(ownerEmail);
            if (guests.isEmpty()) {
                skipped++;
                return;
            }
            for (ExternalAttendee guest : guests) {
                if (!guest.hasEmail()) {
                    continue;
                }
                try {
                    processAttendee(event, guest);
                } catch (RuntimeException e) {
                    log.warnf("참석자 처리 실패로 건너뜁니다: eventId=%s, cause=%s", event.id(), e.getMessage());
                }
            }
        }

        private void processAttendee(ExternalEvent event, ExternalAttendee guest) {
            Optional<Contact> match = contactDirectory.findByEmail(userId, guest.normalizedEmail());
            if (match.isEmpty()) {
                pending.offer(PendingAttendee.from(guest, event));
                return;
            }
            Contact contact = match.get();
            if (mirrored.contains(event.id())) {
                log.debugf("이미 다른 참석자로 기록된 이벤트입니다: eventId=%s, contactId=%s", event.id(), contact.id());
                return;
            }
            LocalCallRecord record = new LocalCallRecord(
                    idGenerator.get(),
                    userId,
                    contact.id(),
                    event.title(),
                    event.timeRange(),
                    event.location(),
                    event.description(),
                    CallStatus.SCHEDULED,
                    PROVIDER,
                    event.id()
            );
            if (!callRecordStore.insertIfAbsent(record)) {
                log.infof("다른 작업에서 이미 미러링된 이벤트입니다: eventId=%s", event.id());
                mirrored.add(event.id());
                return;
            }
            mirrored.add(event.id());
            synced++;
            if (contact.stage().precedes(ContactStage.SCHEDULED)) {
                contactDirectory.advanceStage(userId, contact.id(), ContactStage.SCHEDULED);
            }
        }
    }
}
