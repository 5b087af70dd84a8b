package com.work.genealogy.host.web;

import com.work.genealogy.core.model.Network;
import com.work.genealogy.host.service.NetworkGenealogyService;
import com.work.genealogy.host.web.dto.NetworkView;
import com.work.genealogy.host.web.dto.RegisterNetworkRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/networks")
public class NetworkController {

    private final NetworkGenealogyService service;

    public NetworkController(NetworkGenealogyService service) {
        this.service = service;
    }

    @PostMapping
    public ResponseEntity<NetworkView> register(@Validated @RequestBody RegisterNetworkRequest req) {
        Network network = service.registerNetwork(req.getNetworkId(), req.getName(), req.getHeight(), req.getHash());
        return ResponseEntity.status(HttpStatus.CREATED).body(toView(network));
    }

    @GetMapping("/{id}")
    public ResponseEntity<NetworkView> get(@PathVariable String id) {
        return service.getNetwork(id)
                .map(network -> ResponseEntity.ok(toView(network)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private NetworkView toView(Network network) {
        NetworkView v = new NetworkView();
        v.setId(network.getId());
        v.setNetworkId(network.getNetworkId());
        v.setName(network.getName());
        v.setHash(network.getHistoricBlock().getHash());
        v.setHeight(network.getHistoricBlock().getHeight());
        return v;
    }
}
