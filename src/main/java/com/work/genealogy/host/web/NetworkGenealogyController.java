package com.work.genealogy.host.web;

import com.work.genealogy.core.model.Artifact;
import com.work.genealogy.core.model.ArtifactNetwork;
import com.work.genealogy.core.model.NetworkRef;
import com.work.genealogy.host.service.NetworkGenealogyService;
import com.work.genealogy.host.service.ResolutionReport;
import com.work.genealogy.host.web.dto.ArtifactPayload;
import com.work.genealogy.host.web.dto.ResolveGenealogyRequest;
import com.work.genealogy.host.web.dto.ResolveGenealogyResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 迁移完成后提交本批 artifact，生成 network 族谱。
 */
@RestController
@RequestMapping("/api/v1/genealogies")
public class NetworkGenealogyController {

    private final NetworkGenealogyService service;

    public NetworkGenealogyController(NetworkGenealogyService service) {
        this.service = service;
    }

    @PostMapping("/resolve")
    public ResponseEntity<ResolveGenealogyResponse> resolve(@Validated @RequestBody ResolveGenealogyRequest req) {
        List<Artifact> artifacts = new ArrayList<>(req.getArtifacts().size());
        for (ArtifactPayload payload : req.getArtifacts()) {
            artifacts.add(toArtifact(payload));
        }
        ResolutionReport report = service.resolve(req.getNetworkId(), artifacts);

        ResolveGenealogyResponse resp = new ResolveGenealogyResponse();
        resp.setNetworkId(report.getNetworkId());
        resp.setGenealogyIds(report.getGenealogyIds());
        resp.setEffects(report.getEffects());
        return ResponseEntity.ok(resp);
    }

    // 缺字段的记录原样保留为不完整的 ArtifactNetwork，由 collector 过滤
    private Artifact toArtifact(ArtifactPayload payload) {
        if (payload == null) {
            return null;
        }
        Map<String, ArtifactNetwork> networks = new LinkedHashMap<>();
        if (payload.getNetworks() != null) {
            payload.getNetworks().forEach((chainId, n) -> {
                if (n == null) {
                    return;
                }
                Long height = n.getBlock() == null ? null : n.getBlock().getHeight();
                String networkRecordId = n.getNetwork() == null ? null : n.getNetwork().getId();
                NetworkRef ref = networkRecordId == null || networkRecordId.trim().isEmpty()
                        ? null
                        : NetworkRef.of(networkRecordId);
                networks.put(chainId, new ArtifactNetwork(height, ref));
            });
        }
        return new Artifact(payload.getContractName(), networks);
    }
}
