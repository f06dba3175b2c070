// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.aws.waftrial;

import software.constructs.Construct;

import software.amazon.awscdk.services.ec2.CfnEIP;
import software.amazon.awscdk.services.ec2.CfnEIPAssociation;
import software.amazon.awscdk.services.ec2.CfnPrefixList;
import software.amazon.awscdk.services.ec2.IVpc;
import software.amazon.awscdk.services.ec2.Instance;
import software.amazon.awscdk.services.ec2.InstanceClass;
import software.amazon.awscdk.services.ec2.InstanceSize;
import software.amazon.awscdk.services.ec2.InstanceType;
import software.amazon.awscdk.services.ec2.KeyPair;
import software.amazon.awscdk.services.ec2.MachineImage;
import software.amazon.awscdk.services.ec2.Peer;
import software.amazon.awscdk.services.ec2.Port;
import software.amazon.awscdk.services.ec2.SecurityGroup;
import software.amazon.awscdk.services.ec2.SubnetSelection;
import software.amazon.awscdk.services.ec2.SubnetType;

import software.amazon.awscdk.services.iam.ManagedPolicy;
import software.amazon.awscdk.services.iam.Role;
import software.amazon.awscdk.services.iam.ServicePrincipal;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Bastion host with a static public address and sshd moved to port 443.
 *
 * The elastic IP is also published as a single entry prefix list, which the
 * load balancers use to accept traffic only from this host.
 */
public class BastionHost extends Construct {
    private static final Logger logger = LogManager.getLogger(BastionHost.class);

    static final int SSH_PORT = 443;

    private final CfnEIP eip;
    private final CfnPrefixList prefixList;
    private final SecurityGroup securityGroup;
    private final Instance instance;

    public BastionHost(final Construct scope, final String id, final BastionHostProps props) {
        super(scope, id);

        IVpc vpc = Objects.requireNonNull(props.getVpc(), "vpc");

        eip = CfnEIP.Builder.create(this, "wafTrialBastionServerEIP")
            .domain("vpc")
            .build();

        // maxEntries can be 1..65535, one address is all we need
        prefixList = CfnPrefixList.Builder.create(this, "wafTrialPrefixList")
            .addressFamily("IPv4")
            .maxEntries(1)
            .entries(List.of(CfnPrefixList.EntryProperty.builder()
                .cidr(eip.getRef() + "/32")
                .build()))
            .prefixListName("waf-trial-prefix-list")
            .build();

        KeyPair keyPair = KeyPair.Builder.create(this, "wafTrialKeyPair")
            .keyPairName("waf-trial-key-pair")
            .build();

        securityGroup = SecurityGroup.Builder.create(this, "wafTrialEC2SecurityGroup")
            .vpc(vpc)
            .allowAllOutbound(true)
            .description("security group for waf trial ec2")
            .securityGroupName("waf-trial-ec2-sg")
            .build();

        boolean hasIngress = false;
        if (props.getAllowedIp() != null) {
            securityGroup.addIngressRule(Peer.ipv4(props.getAllowedIp()), Port.tcp(SSH_PORT),
                "allow ssh access from allowed ip");
            logger.info("Bastion accepts ssh on {} from {}", SSH_PORT, props.getAllowedIp());
            hasIngress = true;
        }

        if (props.getAllowedPrefixId() != null) {
            securityGroup.addIngressRule(Peer.prefixList(props.getAllowedPrefixId()), Port.tcp(SSH_PORT),
                "allow ssh access from allowed prefix id");
            logger.info("Bastion accepts ssh on {} from prefix list {}", SSH_PORT, props.getAllowedPrefixId());
            hasIngress = true;
        }

        if (!hasIngress) {
            logger.warn("No allowed ip or prefix list given, the bastion will not accept ssh connections");
        }

        // Session Manager stays available when ssh is closed
        Role role = Role.Builder.create(this, "wafTrialEC2Role")
            .assumedBy(new ServicePrincipal("ec2.amazonaws.com"))
            .managedPolicies(List.of(
                ManagedPolicy.fromAwsManagedPolicyName("AmazonSSMManagedInstanceCore")))
            .build();

        instance = Instance.Builder.create(this, "wafTrialBastionServer")
            .vpc(vpc)
            .instanceType(InstanceType.of(InstanceClass.T3, InstanceSize.NANO))
            .machineImage(MachineImage.latestAmazonLinux2023())
            .keyPair(keyPair)
            .securityGroup(securityGroup)
            .role(role)
            .vpcSubnets(SubnetSelection.builder()
                .subnetType(SubnetType.PUBLIC)
                .build())
            .build();

        instance.addUserData(SshPortRemap.commands(SSH_PORT).toArray(new String[0]));

        CfnEIPAssociation.Builder.create(this, "wafTrialBastionServerEIPAssociation")
            .allocationId(eip.getAttrAllocationId())
            .instanceId(instance.getInstanceId())
            .build();
    }

    public CfnEIP getEip() {
        return eip;
    }

    public String getPrefixListId() {
        return prefixList.getAttrPrefixListId();
    }

    public SecurityGroup getSecurityGroup() {
        return securityGroup;
    }

    public Instance getInstance() {
        return instance;
    }
}
