package com.metascan.explorer.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.metascan.explorer.entity.Session;
import com.metascan.explorer.entity.SessionEntityId;
import com.metascan.explorer.entity.SessionNominator;
import com.metascan.explorer.entity.SessionValidator;
import com.metascan.explorer.modules.jsonapi.JsonApiSerializer;
import com.metascan.explorer.modules.query.FilterParams;
import com.metascan.explorer.modules.query.ItemKey;
import com.metascan.explorer.modules.query.ListQuery;
import com.metascan.explorer.modules.query.QueryResolver;
import com.metascan.explorer.modules.query.ResourceRequest;
import com.metascan.explorer.modules.query.Specs;
import com.metascan.explorer.repository.AccountRepository;
import com.metascan.explorer.repository.BlockRepository;
import com.metascan.explorer.repository.SessionNominatorRepository;
import com.metascan.explorer.repository.SessionRepository;
import com.metascan.explorer.repository.SessionValidatorRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SessionService {

    static final String LATEST_SESSION = "latestSession";

    private final SessionRepository sessionRepository;
    private final SessionValidatorRepository validatorRepository;
    private final SessionNominatorRepository nominatorRepository;
    private final BlockRepository blockRepository;
    private final AccountRepository accountRepository;
    private final QueryResolver queryResolver;
    private final JsonApiSerializer serializer;

    public ObjectNode listSessions(ResourceRequest request) {
        ListQuery<Session> query = ListQuery.<Session>builder()
                .resource("session")
                .executor(sessionRepository)
                .sort(Sort.by(Sort.Direction.DESC, "id"))
                .build();
        return serializer.listDocument(queryResolver.resolve(query, request), serializer::resource);
    }

    public Optional<ObjectNode> getSession(String id, ResourceRequest request) {
        return queryResolver.getItem("session", id, () -> ItemKey.asLong(id).flatMap(sessionRepository::findById))
                .map(session -> {
                    ObjectNode resource = serializer.resource(session);
                    if (request.includes("blocks")) {
                        serializer.withRelatedRecords(resource, "blocks",
                                blockRepository.findBySessionIdOrderByIdDesc(session.getId()));
                    }
                    if (request.includes("validators")) {
                        serializer.withRelatedRecords(resource, "validators",
                                validatorRepository.findBySessionIdOrderByRankValidator(session.getId()));
                    }
                    return serializer.document(resource);
                });
    }

    public ObjectNode listValidators(ResourceRequest request) {
        ListQuery<SessionValidator> query = ListQuery.<SessionValidator>builder()
                .resource("session-validator")
                .executor(validatorRepository)
                .sort(Sort.by("sessionId", "rankValidator"))
                .filters(this::latestSession)
                .build();
        return serializer.listDocument(queryResolver.resolve(query, request), serializer::resource);
    }

    public Optional<ObjectNode> getValidator(String id, ResourceRequest request) {
        return queryResolver.getItem("session-validator", id, () -> ItemKey.split(id, 2)
                        .flatMap(parts -> ItemKey.asLong(parts.get(0))
                                .flatMap(session -> ItemKey.asInt(parts.get(1))
                                        .map(rank -> new SessionEntityId.Validator(session, rank))))
                        .flatMap(validatorRepository::findById))
                .map(validator -> serializer.document(renderValidator(validator, request)));
    }

    public ObjectNode listNominators(ResourceRequest request) {
        ListQuery<SessionNominator> query = ListQuery.<SessionNominator>builder()
                .resource("session-nominator")
                .executor(nominatorRepository)
                .sort(Sort.by("sessionId", "rankValidator", "rankNominator"))
                .filters(this::latestSession)
                .build();
        return serializer.listDocument(queryResolver.resolve(query, request), serializer::resource);
    }

    private ObjectNode renderValidator(SessionValidator validator, ResourceRequest request) {
        ObjectNode resource = serializer.resource(validator);
        ObjectNode attributes = (ObjectNode) resource.get("attributes");
        Optional.ofNullable(validator.getValidatorStash())
                .flatMap(accountRepository::findById)
                .ifPresent(account -> attributes.set("validator_stash_account", serializer.resource(account)));
        Optional.ofNullable(validator.getValidatorController())
                .flatMap(accountRepository::findById)
                .ifPresent(account -> attributes.set("validator_controller_account", serializer.resource(account)));
        if (request.includes("nominators")) {
            serializer.withRelatedRecords(resource, "nominators",
                    nominatorRepository.findBySessionIdAndRankValidatorOrderByRankNominator(
                            validator.getSessionId(), validator.getRankValidator()));
        }
        return resource;
    }

    /**
     * Restricts to the newest session when {@code filter[latestSession]} is set; with no sessions
     * stored nothing matches.
     */
    private <T> Specification<T> latestSession(FilterParams filters) {
        if (!filters.has(LATEST_SESSION)) {
            return Specs.all();
        }
        return sessionRepository.findFirstByOrderByIdDesc()
                .<Specification<T>>map(session -> Specs.equal("sessionId", session.getId()))
                .orElseGet(Specs::none);
    }
}
