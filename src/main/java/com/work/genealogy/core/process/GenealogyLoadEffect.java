package com.work.genealogy.core.process;

import com.work.genealogy.core.model.NetworkGenealogyInput;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.work.genealogy.core.support.ValidationUtils.requireNonNull;

/**
 * 存储写入：一次性提交全部族谱边，结果为按输入顺序分配的 id。
 */
public class GenealogyLoadEffect implements Effect<List<String>> {

    private final List<NetworkGenealogyInput> genealogies;

    public GenealogyLoadEffect(List<NetworkGenealogyInput> genealogies) {
        this.genealogies = Collections.unmodifiableList(new ArrayList<>(requireNonNull(genealogies, "genealogies")));
    }

    public List<NetworkGenealogyInput> getGenealogies() {
        return genealogies;
    }

    @Override
    public List<String> accept(EffectVisitor visitor) {
        return visitor.visitGenealogyLoad(this);
    }

    @Override
    public String describe() {
        return "load networkGenealogies(" + genealogies.size() + ")";
    }
}
