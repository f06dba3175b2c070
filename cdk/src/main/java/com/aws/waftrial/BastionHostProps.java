// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.aws.waftrial;

import software.amazon.awscdk.services.ec2.IVpc;

public interface BastionHostProps {

    public static Builder builder() {
        return new Builder();
    }

    IVpc getVpc();

    String getAllowedIp();

    String getAllowedPrefixId();

    public static class Builder {
        private IVpc vpc;
        private String allowedIp;
        private String allowedPrefixId;

        public Builder vpc(IVpc vpc) {
            this.vpc = vpc;
            return this;
        }

        public Builder allowedIp(String allowedIp) {
            this.allowedIp = allowedIp;
            return this;
        }

        public Builder allowedPrefixId(String allowedPrefixId) {
            this.allowedPrefixId = allowedPrefixId;
            return this;
        }

        public BastionHostProps build() {
            return new BastionHostProps() {

                @Override
                public IVpc getVpc() {
                    return vpc;
                }

                @Override
                public String getAllowedIp() {
                    return allowedIp;
                }

                @Override
                public String getAllowedPrefixId() {
                    return allowedPrefixId;
                }
            };
        }
    }
}
