package com.metascan.explorer.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.metascan.explorer.entity.Block;
import com.metascan.explorer.entity.BlockTotal;
import com.metascan.explorer.modules.jsonapi.JsonApiSerializer;
import com.metascan.explorer.modules.query.ItemKey;
import com.metascan.explorer.modules.query.ListQuery;
import com.metascan.explorer.modules.query.QueryResolver;
import com.metascan.explorer.modules.query.ResourceRequest;
import com.metascan.explorer.modules.query.Specs;
import com.metascan.explorer.repository.BlockRepository;
import com.metascan.explorer.repository.BlockTotalRepository;
import com.metascan.explorer.repository.EventRepository;
import com.metascan.explorer.repository.ExtrinsicRepository;
import com.metascan.explorer.repository.LogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Blocks and their running totals.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BlockService {

    private static final List<String> PARAMS = List.of("params");

    private final BlockRepository blockRepository;
    private final BlockTotalRepository blockTotalRepository;
    private final ExtrinsicRepository extrinsicRepository;
    private final EventRepository eventRepository;
    private final LogRepository logRepository;
    private final AccountService accountService;
    private final QueryResolver queryResolver;
    private final JsonApiSerializer serializer;

    public ObjectNode listBlocks(ResourceRequest request) {
        ListQuery<Block> query = ListQuery.<Block>builder()
                .resource("block")
                .executor(blockRepository)
                .sort(Sort.by(Sort.Direction.DESC, "id"))
                .build();
        return serializer.listDocument(queryResolver.resolve(query, request), serializer::resource);
    }

    public Optional<ObjectNode> getBlock(String id, ResourceRequest request) {
        return queryResolver.getItem("block", id, () -> findBlock(id))
                .map(block -> serializer.document(withRelationships(block, request)));
    }

    public ObjectNode listBlockTotals(ResourceRequest request) {
        ListQuery<BlockTotal> query = ListQuery.<BlockTotal>builder()
                .resource("blocktotal")
                .executor(blockTotalRepository)
                .sort(Sort.by(Sort.Direction.DESC, "id"))
                .filters(filters -> {
                    Specification<BlockTotal> spec = Specs.all();
                    Optional<String> author = filters.getDecodedDid("author");
                    if (author.isPresent()) {
                        spec = spec.and(Specs.equal("author", author.get()));
                    }
                    return spec;
                })
                .build();
        return serializer.listDocument(queryResolver.resolve(query, request), this::renderTotal);
    }

    public Optional<ObjectNode> getBlockTotal(String id) {
        return queryResolver.getItem("blocktotal", id, () -> ItemKey.asLong(id)
                        .or(() -> blockRepository.findFirstByHash(id).map(Block::getId))
                        .flatMap(blockTotalRepository::findById))
                .map(total -> serializer.document(renderTotal(total)));
    }

    private Optional<Block> findBlock(String id) {
        Optional<Long> number = ItemKey.asLong(id);
        if (number.isPresent()) {
            return blockRepository.findById(number.get());
        }
        return blockRepository.findFirstByHash(id);
    }

    private ObjectNode withRelationships(Block block, ResourceRequest request) {
        ObjectNode resource = serializer.resource(block);
        Long blockId = block.getId();
        if (request.includes("extrinsics")) {
            serializer.withRelatedRecords(resource, "extrinsics",
                    extrinsicRepository.findByBlockIdOrderByExtrinsicIdx(blockId));
        }
        if (request.includes("transactions")) {
            serializer.withRelationship(resource, "transactions",
                    extrinsicRepository.findByBlockIdAndSignedOrderByExtrinsicIdx(blockId, 1).stream()
                            .map(extrinsic -> serializer.resource(extrinsic, PARAMS))
                            .toList());
        }
        if (request.includes("inherents")) {
            serializer.withRelationship(resource, "inherents",
                    extrinsicRepository.findByBlockIdAndSignedOrderByExtrinsicIdx(blockId, 0).stream()
                            .map(extrinsic -> serializer.resource(extrinsic, PARAMS))
                            .toList());
        }
        if (request.includes("events")) {
            serializer.withRelatedRecords(resource, "events", eventRepository.findByBlockIdOrderByEventIdx(blockId));
        }
        if (request.includes("logs")) {
            serializer.withRelatedRecords(resource, "logs", logRepository.findByBlockIdOrderByLogIdx(blockId));
        }
        return resource;
    }

    private ObjectNode renderTotal(BlockTotal total) {
        ObjectNode resource = serializer.resource(total);
        accountService.findByAddress(total.getAuthor())
                .ifPresent(author -> ((ObjectNode) resource.get("attributes"))
                        .set("author_account", serializer.resource(author)));
        return resource;
    }
}
