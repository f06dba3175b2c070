// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.aws.waftrial;

import software.amazon.awscdk.services.ec2.IVpc;

public interface WebGoatServiceProps {

    public static Builder builder() {
        return new Builder();
    }

    IVpc getVpc();

    String getImage();

    public static class Builder {
        private IVpc vpc;
        private String image = WebGoatService.DEFAULT_IMAGE;

        public Builder vpc(IVpc vpc) {
            this.vpc = vpc;
            return this;
        }

        public Builder image(String image) {
            this.image = image;
            return this;
        }

        public WebGoatServiceProps build() {
            return new WebGoatServiceProps() {

                @Override
                public IVpc getVpc() {
                    return vpc;
                }

                @Override
                public String getImage() {
                    return image;
                }
            };
        }
    }
}
