/*
 * Copyright [2013-2016] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.scorebin.container.obj;

import ml.shifu.scorebin.exception.BinningErrorCode;
import ml.shifu.scorebin.exception.BinningException;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Weights of the composite objective {@code separability * w_sep + iv * w_iv + ks * w_ks - psi * w_psi}, the
 * 'weights' part of the binning config.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ObjectiveWeights {

    public static final ObjectiveWeights DEFAULT = new ObjectiveWeights(0.7d, 0.2d, 0.1d, 0d);

    private final double separability;

    private final double iv;

    private final double ks;

    /**
     * PSI penalty, 0 keeps the objective to the classic three terms.
     */
    private final double psi;

    @JsonCreator
    public ObjectiveWeights(@JsonProperty("separability") Double separability, @JsonProperty("iv") Double iv,
            @JsonProperty("ks") Double ks, @JsonProperty("psi") Double psi) {
        this.separability = separability == null ? 0.7d : separability;
        this.iv = iv == null ? 0.2d : iv;
        this.ks = ks == null ? 0.1d : ks;
        this.psi = psi == null ? 0d : psi;
        if(this.separability < 0 || this.iv < 0 || this.ks < 0 || this.psi < 0) {
            throw new BinningException(BinningErrorCode.ERROR_INVALID_BINNING_CONFIG,
                    "Objective weights must not be negative: " + this);
        }
    }

    public ObjectiveWeights(double separability, double iv, double ks) {
        this(separability, iv, ks, 0d);
    }

    public double getSeparability() {
        return separability;
    }

    public double getIv() {
        return iv;
    }

    public double getKs() {
        return ks;
    }

    public double getPsi() {
        return psi;
    }

    @Override
    public String toString() {
        return "ObjectiveWeights [separability=" + separability + ", iv=" + iv + ", ks=" + ks + ", psi=" + psi + "]";
    }

}
