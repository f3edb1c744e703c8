package com.metascan.explorer.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.metascan.explorer.entity.Contract;
import com.metascan.explorer.modules.jsonapi.JsonApiSerializer;
import com.metascan.explorer.modules.query.ListQuery;
import com.metascan.explorer.modules.query.QueryResolver;
import com.metascan.explorer.modules.query.ResourceRequest;
import com.metascan.explorer.repository.ContractRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ContractService {

    private final ContractRepository contractRepository;
    private final QueryResolver queryResolver;
    private final JsonApiSerializer serializer;

    public ObjectNode listContracts(ResourceRequest request) {
        ListQuery<Contract> query = ListQuery.<Contract>builder()
                .resource("contract")
                .executor(contractRepository)
                .sort(Sort.by(Sort.Direction.DESC, "createdAtBlock"))
                .build();
        return serializer.listDocument(queryResolver.resolve(query, request), serializer::resource);
    }

    public Optional<ObjectNode> getContract(String codeHash) {
        return queryResolver.getItem("contract", codeHash, () -> contractRepository.findById(codeHash))
                .map(contract -> serializer.document(serializer.resource(contract)));
    }
}
