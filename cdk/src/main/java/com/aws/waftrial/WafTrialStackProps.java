// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.aws.waftrial;

import software.amazon.awscdk.Environment;
import software.amazon.awscdk.StackProps;

public interface WafTrialStackProps extends StackProps {

    public static Builder builder() {
        return new Builder();
    }

    /** IPv4 CIDR allowed to reach the bastion, or null. */
    String getAllowedIp();

    /** Managed prefix list id allowed to reach the bastion, or null. */
    String getAllowedPrefixId();

    String getWebGoatImage();

    public static class Builder {
        private Environment env;
        private String stackName;
        private String allowedIp;
        private String allowedPrefixId;
        private String webGoatImage = WebGoatService.DEFAULT_IMAGE;

        public Builder env(Environment env) {
            this.env = env;
            return this;
        }

        public Builder stackName(String stackName) {
            this.stackName = stackName;
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

        public Builder webGoatImage(String webGoatImage) {
            this.webGoatImage = webGoatImage;
            return this;
        }

        public WafTrialStackProps build() {
            return new WafTrialStackProps() {

                @Override
                public Environment getEnv() {
                    return env;
                }

                @Override
                public String getStackName() {
                    return stackName;
                }

                @Override
                public String getAllowedIp() {
                    return allowedIp;
                }

                @Override
                public String getAllowedPrefixId() {
                    return allowedPrefixId;
                }

                @Override
                public String getWebGoatImage() {
                    return webGoatImage;
                }
            };
        }
    }
}
