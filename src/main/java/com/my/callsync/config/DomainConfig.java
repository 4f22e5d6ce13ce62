package com.my.callsync.config;

import com.my.callsync.adapter.out.clock.SystemClockAdapter;
import com.my.callsync.domain.model.WorkHourPolicy;
import com.my.callsync.domain.port.in.AvailabilityUseCase;
import com.my.callsync.domain.port.in.CalendarConnectionUseCase;
import com.my.callsync.domain.port.in.ConfirmPendingContactsUseCase;
import com.my.callsync.domain.port.in.PushCallRecordUseCase;
import com.my.callsync.domain.port.in.SyncCallsUseCase;
import com.my.callsync.domain.port.out.CalendarPort;
import com.my.callsync.domain.port.out.CallRecordStorePort;
import com.my.callsync.domain.port.out.ClockPort;
import com.my.callsync.domain.port.out.ContactDirectoryPort;
import com.my.callsync.domain.port.out.CredentialStorePort;
import com.my.callsync.domain.port.out.OAuthTokenPort;
import com.my.callsync.domain.port.out.UserLeasePort;
import com.my.callsync.domain.service.AvailabilityComputer;
import com.my.callsync.domain.service.AvailabilityService;
import com.my.callsync.domain.service.CalendarClient;
import com.my.callsync.domain.service.CalendarConnectionService;
import com.my.callsync.domain.service.ContactResolutionService;
import com.my.callsync.domain.service.OutreachComposer;
import com.my.callsync.domain.service.PushGateway;
import com.my.callsync.domain.service.SyncEngine;
import com.my.callsync.domain.service.TokenVault;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import java.time.Duration;
import java.time.ZoneOffset;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하기 위함.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @ApplicationScoped
    public TokenVault tokenVault(CredentialStorePort credentialStore,
                                 OAuthTokenPort tokenPort,
                                 UserLeasePort leasePort,
                                 ClockPort clockPort,
                                 AppConfig appConfig) {
        return new TokenVault(credentialStore, tokenPort, leasePort, clockPort,
                Duration.ofSeconds(appConfig.google().refreshSkewSeconds()));
    }

    @Produces
    @ApplicationScoped
    public CalendarClient calendarClient(TokenVault tokenVault, CalendarPort calendarPort, AppConfig appConfig) {
        return new CalendarClient(tokenVault, calendarPort, appConfig.google().maxResults());
    }

    @Produces
    @ApplicationScoped
    public SyncCallsUseCase syncCallsUseCase(TokenVault tokenVault,
                                             CalendarClient calendarClient,
                                             CallRecordStorePort callRecordStore,
                                             ContactDirectoryPort contactDirectory,
                                             UserLeasePort leasePort) {
        return new SyncEngine(tokenVault, calendarClient, callRecordStore, contactDirectory, leasePort);
    }

    @Produces
    @ApplicationScoped
    public PushCallRecordUseCase pushCallRecordUseCase(TokenVault tokenVault,
                                                       CalendarClient calendarClient,
                                                       CallRecordStorePort callRecordStore,
                                                       ContactDirectoryPort contactDirectory,
                                                       UserLeasePort leasePort) {
        return new PushGateway(tokenVault, calendarClient, callRecordStore, contactDirectory, leasePort);
    }

    @Produces
    @ApplicationScoped
    public ConfirmPendingContactsUseCase confirmPendingContactsUseCase(ContactDirectoryPort contactDirectory,
                                                                      CallRecordStorePort callRecordStore) {
        return new ContactResolutionService(contactDirectory, callRecordStore);
    }

    @Produces
    @ApplicationScoped
    public CalendarConnectionUseCase calendarConnectionUseCase(OAuthTokenPort tokenPort,
                                                               TokenVault tokenVault,
                                                               CredentialStorePort credentialStore) {
        return new CalendarConnectionService(tokenPort, tokenVault, credentialStore);
    }

    @Produces
    @ApplicationScoped
    public AvailabilityUseCase availabilityUseCase(CredentialStorePort credentialStore,
                                                   CalendarClient calendarClient,
                                                   AppConfig appConfig) {
        AppConfig.AvailabilityConfig availability = appConfig.availability();
        WorkHourPolicy policy = new WorkHourPolicy(
                availability.startHour(),
                availability.endHour(),
                ZoneOffset.ofHours(availability.utcOffsetHours()),
                availability.zoneLabel()
        );
        return new AvailabilityService(
                credentialStore,
                calendarClient,
                new AvailabilityComputer(),
                new OutreachComposer(),
                policy,
                availability.targetWeekdays(),
                availability.maxScanDays(),
                Duration.ofDays(availability.lookaheadDays())
        );
    }

    @Produces
    @ApplicationScoped
    public ClockPort clockPort() {
        return SystemClockAdapter.system();
    }
}
